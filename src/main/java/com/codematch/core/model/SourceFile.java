package com.codematch.core.model;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single uploaded file. Immutable once stored.
 *
 * @param path    the path the file was uploaded under
 * @param content raw file bytes
 */
public record SourceFile(
    String path,
    byte[] content
) implements Serializable {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        content = content.clone();
    }

    public static SourceFile ofText(String path, String text) {
        return new SourceFile(path, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentAsText() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /** Raw byte length, the unit the session size cap is enforced in. */
    public long size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile other)) return false;
        return path.equals(other.path) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "SourceFile[path=" + path + ", size=" + content.length + "]";
    }
}
