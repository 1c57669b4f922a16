package com.example.retrain.lifecycle;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Versioned artifact storage with a single "current" reference.
 * <p>
 * Versions are immutable once written. {@link #swapPointer} must be a single indivisible
 * step: readers observe either the old or the new version, never a partial write.
 */
public interface ArtifactStore {

    /** Store a new version; it becomes visible only once completely written. */
    ModelArtifact write(ModelArtifact artifact) throws IOException;

    Optional<ModelArtifact> read(long version) throws IOException;

    void delete(long version) throws IOException;

    List<Long> listVersions() throws IOException;

    OptionalLong readPointer() throws IOException;

    void swapPointer(long version) throws IOException;

    void clearPointer() throws IOException;

    ArtifactHistory readHistory() throws IOException;

    void writeHistory(ArtifactHistory history) throws IOException;
}
