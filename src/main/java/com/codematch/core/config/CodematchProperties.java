package com.codematch.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "codematch")
public class CodematchProperties {

    private Session session = new Session();
    private Remote validation = new Remote(60);
    private Remote matching = new Remote(120);
    private Chains chains = new Chains();
    private RemoteFiles remoteFiles = new RemoteFiles();

    // -- Flat accessors (delegate to nested) --
    public long getMaxSessionBytes() { return session.maxSizeBytes; }
    public int getSessionIdleTimeoutMinutes() { return session.idleTimeoutMinutes; }
    public List<String> getSupportedChains() { return chains.supported; }

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Remote getValidation() { return validation; }
    public void setValidation(Remote validation) { this.validation = validation; }
    public Remote getMatching() { return matching; }
    public void setMatching(Remote matching) { this.matching = matching; }
    public Chains getChains() { return chains; }
    public void setChains(Chains chains) { this.chains = chains; }
    public RemoteFiles getRemoteFiles() { return remoteFiles; }
    public void setRemoteFiles(RemoteFiles remoteFiles) { this.remoteFiles = remoteFiles; }

    public static class Session {
        private long maxSizeBytes = 50L * 1024 * 1024;  // 50 MiB
        private int idleTimeoutMinutes = 120;

        public long getMaxSizeBytes() { return maxSizeBytes; }
        public void setMaxSizeBytes(long maxSizeBytes) { this.maxSizeBytes = maxSizeBytes; }
        public int getIdleTimeoutMinutes() { return idleTimeoutMinutes; }
        public void setIdleTimeoutMinutes(int idleTimeoutMinutes) { this.idleTimeoutMinutes = idleTimeoutMinutes; }
    }

    /** Connection settings for one external service. */
    public static class Remote {
        private String url = "";
        private int timeoutSeconds;

        public Remote() {
            this(60);
        }

        Remote(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Chains {
        private List<String> supported = new ArrayList<>();

        public List<String> getSupported() { return supported; }
        public void setSupported(List<String> supported) { this.supported = supported; }
    }

    /** Uploads by URL: {@code POST /api/v1/session/input-files?url=...}. */
    public static class RemoteFiles {
        private int timeoutSeconds = 30;

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
