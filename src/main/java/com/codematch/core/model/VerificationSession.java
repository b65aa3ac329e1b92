package com.codematch.core.model;

import com.codematch.core.store.ContentAddressedFileStore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-user verification state: the uploaded files, the contract candidates assembled from
 * them, and the paths no candidate claimed.
 * <p>
 * Not thread-safe. Requests against one session are expected to be serialized by the caller.
 */
public class VerificationSession implements Serializable {

    private final String id;
    private final ContentAddressedFileStore files;
    private final Map<String, ContractCandidate> candidates = new LinkedHashMap<>();
    private final Set<String> unusedFiles = new LinkedHashSet<>();
    private final Instant createdAt;
    private Instant lastAccessedAt;

    public VerificationSession(String id, long maxSizeBytes) {
        this.id = id;
        this.files = new ContentAddressedFileStore(maxSizeBytes);
        this.createdAt = Instant.now();
        this.lastAccessedAt = createdAt;
    }

    public String getId() { return id; }
    public ContentAddressedFileStore files() { return files; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastAccessedAt() { return lastAccessedAt; }

    public void touch(Instant now) {
        lastAccessedAt = now;
    }

    public Optional<ContractCandidate> candidate(String candidateId) {
        return Optional.ofNullable(candidates.get(candidateId));
    }

    public Collection<ContractCandidate> candidates() {
        return Collections.unmodifiableCollection(candidates.values());
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }

    public void addCandidate(ContractCandidate candidate) {
        if (candidates.containsKey(candidate.getId())) {
            throw new IllegalStateException("Candidate already present: " + candidate.getId());
        }
        candidates.put(candidate.getId(), candidate);
    }

    public List<String> unusedFiles() {
        return List.copyOf(unusedFiles);
    }

    public void replaceUnusedFiles(Collection<String> paths) {
        unusedFiles.clear();
        unusedFiles.addAll(paths);
    }

    public SessionSnapshot snapshot() {
        List<SessionSnapshot.CandidateSummary> summaries = new ArrayList<>();
        for (ContractCandidate c : candidates.values()) {
            summaries.add(SessionSnapshot.CandidateSummary.of(c));
        }
        return new SessionSnapshot(id, summaries, unusedFiles());
    }
}
