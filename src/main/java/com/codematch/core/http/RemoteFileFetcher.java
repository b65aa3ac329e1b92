package com.codematch.core.http;

import com.codematch.core.config.CodematchProperties;
import com.codematch.core.error.InvalidRequestException;
import com.codematch.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * Downloads a single file a caller points at by URL so it can be added to a session.
 * Only {@code http} and {@code https} URLs are accepted. The file is named after the
 * last segment of the URL path.
 */
@Component
public class RemoteFileFetcher {

    private static final Logger log = LoggerFactory.getLogger(RemoteFileFetcher.class);

    static final String DEFAULT_NAME = "remote-file";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RemoteFileFetcher(CodematchProperties properties) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                Duration.ofSeconds(properties.getRemoteFiles().getTimeoutSeconds()));
    }

    RemoteFileFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * @throws InvalidRequestException if the URL is malformed, unreachable or answers with a non-2xx status
     */
    public SourceFile fetch(String url) {
        URI uri = parse(url);
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new InvalidRequestException("Could not fetch " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidRequestException("Fetching " + url + " was interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new InvalidRequestException("Fetching " + url + " returned HTTP " + status);
        }
        byte[] body = response.body() != null ? response.body() : new byte[0];
        String name = fileName(uri);
        log.info("Fetched {} ({} bytes) from {}", name, body.length, uri.getHost());
        return new SourceFile(name, body);
    }

    private static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidRequestException("A url is required");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("Invalid url: " + url, e);
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new InvalidRequestException("Only http and https urls can be fetched: " + url);
        }
        return uri;
    }

    static String fileName(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return DEFAULT_NAME;
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        String last = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return last.isBlank() ? DEFAULT_NAME : last;
    }
}
