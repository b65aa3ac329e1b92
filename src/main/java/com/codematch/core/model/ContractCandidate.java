package com.codematch.core.model;

import com.codematch.core.store.ContentHasher;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The unit of verification work: one compilable contract described by a metadata file,
 * together with the sources resolved for it so far and an optional verification target.
 * <p>
 * The id is derived from the raw metadata, so resubmitting the same metadata always
 * yields the same id. Resolved and missing source paths are kept disjoint.
 */
public class ContractCandidate implements Serializable {

    private final String id;
    private final String name;
    private final String compiledPath;
    private final String compilerVersion;
    private final String metadataRaw;

    private final Map<String, String> resolvedSources = new LinkedHashMap<>();
    private final Set<String> missingSources = new LinkedHashSet<>();
    private final Set<String> invalidSources = new LinkedHashSet<>();

    private String address;
    private String chainId;
    private CandidateStatus status = CandidateStatus.PENDING;
    private String statusMessage;
    private Instant storageTimestamp;
    private String confirmedAddress;
    private String confirmedChainId;

    public ContractCandidate(String name,
                             String compiledPath,
                             String compilerVersion,
                             String metadataRaw,
                             Map<String, String> resolvedSources,
                             Collection<String> missingSources,
                             Collection<String> invalidSources) {
        this.metadataRaw = Objects.requireNonNull(metadataRaw, "metadataRaw");
        this.id = ContentHasher.hashHex(metadataRaw);
        this.name = name;
        this.compiledPath = compiledPath;
        this.compilerVersion = compilerVersion;
        replaceSources(resolvedSources, missingSources, invalidSources);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getCompiledPath() { return compiledPath; }
    public String getCompilerVersion() { return compilerVersion; }
    public String getMetadataRaw() { return metadataRaw; }
    public Map<String, String> getResolvedSources() { return Collections.unmodifiableMap(resolvedSources); }
    public Set<String> getMissingSources() { return Collections.unmodifiableSet(missingSources); }
    public Set<String> getInvalidSources() { return Collections.unmodifiableSet(invalidSources); }
    public String getAddress() { return address; }
    public String getChainId() { return chainId; }
    public CandidateStatus getStatus() { return status; }
    public String getStatusMessage() { return statusMessage; }
    public Instant getStorageTimestamp() { return storageTimestamp; }

    public boolean hasCompilerVersion() {
        return compilerVersion != null && !compilerVersion.isBlank();
    }

    public boolean hasTarget() {
        return address != null && chainId != null;
    }

    /**
     * True when the current status is a perfect or partial match recorded for the
     * current target. Reassigning the target to a different pair clears this.
     */
    public boolean isConfirmedForTarget() {
        return status.isConfirmedMatch()
                && hasTarget()
                && address.equals(confirmedAddress)
                && chainId.equals(confirmedChainId);
    }

    /**
     * A candidate is valid when it has no invalid sources and, unless {@code ignoreMissing},
     * no missing sources.
     */
    public boolean isValid(boolean ignoreMissing) {
        return (ignoreMissing || missingSources.isEmpty()) && invalidSources.isEmpty();
    }

    /**
     * Records the content for a source path, moving it out of the missing and invalid sets.
     */
    public void resolveSource(String path, String content) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        resolvedSources.put(path, content);
        missingSources.remove(path);
        invalidSources.remove(path);
    }

    /**
     * Replaces the source bookkeeping wholesale. Paths listed as both resolved and missing
     * are treated as resolved.
     */
    public void replaceSources(Map<String, String> resolved,
                               Collection<String> missing,
                               Collection<String> invalid) {
        Map<String, String> newResolved = resolved != null ? new LinkedHashMap<>(resolved) : Map.of();
        Set<String> newMissing = missing != null ? new LinkedHashSet<>(missing) : new LinkedHashSet<>();
        newMissing.removeAll(newResolved.keySet());

        resolvedSources.clear();
        resolvedSources.putAll(newResolved);
        missingSources.clear();
        missingSources.addAll(newMissing);
        invalidSources.clear();
        if (invalid != null) {
            invalidSources.addAll(invalid);
        }
    }

    /**
     * Sets the verification target. A target, once set, can be replaced but never cleared.
     */
    public void assignTarget(String address, String chainId) {
        this.address = Objects.requireNonNull(address, "address");
        this.chainId = Objects.requireNonNull(chainId, "chainId");
    }

    public void setStatus(CandidateStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Copies the outcome of a verification attempt onto this candidate.
     * A match without a status is recorded as {@link CandidateStatus#ERROR}.
     */
    public void recordMatch(Match match) {
        this.status = match.status() != null ? match.status() : CandidateStatus.ERROR;
        this.statusMessage = match.message();
        this.storageTimestamp = match.storageTimestamp();
        if (this.status.isConfirmedMatch()) {
            this.confirmedAddress = address;
            this.confirmedChainId = chainId;
        }
    }

    @Override
    public String toString() {
        return "ContractCandidate[id=" + id + ", name=" + name + ", status=" + status
                + ", missing=" + missingSources + "]";
    }
}
