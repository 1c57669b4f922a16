package com.example.retrain.lifecycle;

import java.util.List;

/**
 * Persisted lifecycle bookkeeping.
 *
 * @param served            versions that have been current, oldest first; the last one is current
 *                          and the others are retained backups
 * @param lastIssuedVersion highest version number ever assigned, kept so numbers are never reused
 */
public record ArtifactHistory(List<Long> served, long lastIssuedVersion) {

    public static final ArtifactHistory EMPTY = new ArtifactHistory(List.of(), 0L);

    public ArtifactHistory {
        served = served == null ? List.of() : List.copyOf(served);
    }
}
