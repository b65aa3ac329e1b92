package com.codematch.core.store;

import com.codematch.core.error.CapacityExceededException;
import com.codematch.core.model.SourceFile;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-owned set of uploaded files keyed by content hash.
 * <p>
 * Files are never removed. The total raw byte size is capped; a batch that would push the
 * total past the cap is rejected as a whole.
 */
public class ContentAddressedFileStore implements Serializable {

    private final long maxBytes;
    private final Map<String, SourceFile> filesByHash = new LinkedHashMap<>();
    private long totalBytes;

    public ContentAddressedFileStore(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Admits a batch of files.
     *
     * @param batch files to add; files whose content is already stored are skipped
     * @return the number of files that were not already present
     * @throws CapacityExceededException if current size plus the batch size exceeds the cap;
     *                                   nothing from the batch is stored in that case
     */
    public int put(List<SourceFile> batch) {
        long incoming = 0;
        for (SourceFile file : batch) {
            incoming += file.size();
        }
        long requested = totalBytes + incoming;
        if (requested > maxBytes) {
            throw new CapacityExceededException(requested, maxBytes);
        }

        int added = 0;
        for (SourceFile file : batch) {
            String hash = ContentHasher.hashHex(file.content());
            if (!filesByHash.containsKey(hash)) {
                filesByHash.put(hash, file);
                totalBytes += file.size();
                added++;
            }
        }
        return added;
    }

    public List<SourceFile> all() {
        return Collections.unmodifiableList(new ArrayList<>(filesByHash.values()));
    }

    public List<String> paths() {
        return filesByHash.values().stream().map(SourceFile::path).toList();
    }

    public boolean containsHash(String hash) {
        return filesByHash.containsKey(hash);
    }

    public int count() {
        return filesByHash.size();
    }

    public long totalBytes() {
        return totalBytes;
    }

    public long maxBytes() {
        return maxBytes;
    }
}
