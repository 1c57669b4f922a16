package com.example.retrain.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * {@link ArtifactStore} on a local directory:
 * <pre>
 * models/
 *   versions/v000001.json   one immutable JSON document per version
 *   CURRENT                 the serving version number
 *   history.json            {@link ArtifactHistory}
 * </pre>
 * Every file is written to a temporary sibling first and then atomically renamed into place.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final String POINTER = "CURRENT";
    private static final String HISTORY = "history.json";

    private final Path root;
    private final Path versions;
    private final ObjectMapper om;

    public FileSystemArtifactStore(Path root, ObjectMapper om) {
        this.root = root;
        this.versions = root.resolve("versions");
        this.om = om;
        try {
            Files.createDirectories(versions);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public ModelArtifact write(ModelArtifact artifact) throws IOException {
        Path target = versionPath(artifact.version());
        if (Files.exists(target)) {
            throw new IOException("Version already stored: " + target);
        }
        ModelArtifact located = artifact.withStorageLocation(target.toAbsolutePath().toString());
        Path tmp = versions.resolve("." + target.getFileName() + ".tmp");
        om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), located);
        atomicMove(tmp, target);
        return located;
    }

    @Override
    public Optional<ModelArtifact> read(long version) throws IOException {
        Path p = versionPath(version);
        if (Files.notExists(p)) return Optional.empty();
        return Optional.of(om.readValue(p.toFile(), ModelArtifact.class));
    }

    @Override
    public void delete(long version) throws IOException {
        Files.deleteIfExists(versionPath(version));
    }

    @Override
    public List<Long> listVersions() throws IOException {
        List<Long> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(versions)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.matches("v\\d+\\.json"))
                    .forEach(n -> out.add(Long.parseLong(n.substring(1, n.length() - 5))));
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public OptionalLong readPointer() throws IOException {
        Path p = root.resolve(POINTER);
        if (Files.notExists(p)) return OptionalLong.empty();
        String s = Files.readString(p, StandardCharsets.UTF_8).trim();
        try {
            return OptionalLong.of(Long.parseLong(s));
        } catch (NumberFormatException e) {
            throw new IOException("Unreadable model pointer " + p + ": '" + s + "'", e);
        }
    }

    @Override
    public void swapPointer(long version) throws IOException {
        Path tmp = root.resolve("." + POINTER + ".tmp");
        Files.writeString(tmp, Long.toString(version), StandardCharsets.UTF_8);
        atomicMove(tmp, root.resolve(POINTER));
    }

    @Override
    public void clearPointer() throws IOException {
        Files.deleteIfExists(root.resolve(POINTER));
    }

    @Override
    public ArtifactHistory readHistory() throws IOException {
        Path p = root.resolve(HISTORY);
        if (Files.notExists(p)) return ArtifactHistory.EMPTY;
        return om.readValue(p.toFile(), ArtifactHistory.class);
    }

    @Override
    public void writeHistory(ArtifactHistory history) throws IOException {
        Path tmp = root.resolve("." + HISTORY + ".tmp");
        om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), history);
        atomicMove(tmp, root.resolve(HISTORY));
    }

    private Path versionPath(long version) {
        return versions.resolve(String.format(Locale.ROOT, "v%06d.json", version));
    }

    private static void atomicMove(Path from, Path to) throws IOException {
        Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
