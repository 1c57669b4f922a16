package com.example.retrain.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@link AppendOnlyLog} stored as one JSON document per line.
 * <p>
 * Appends are forced to the device before returning. A line that does not parse
 * raises {@link StorageCorruptedException} naming the file and line number.
 * Instances are thread-safe; one instance per file.
 */
public class JsonLinesLog<T> implements AppendOnlyLog<T> {

    private final Path path;
    private final ObjectMapper mapper;
    private final Class<T> type;
    private final Function<T, Instant> timestamp;

    public JsonLinesLog(Path path, ObjectMapper mapper, Class<T> type, Function<T, Instant> timestamp) {
        this.path = path;
        this.mapper = mapper;
        this.type = type;
        this.timestamp = timestamp;
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            if (Files.notExists(path)) Files.createFile(path);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public synchronized void append(T record) {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record is not serializable: " + record, e);
        }
        try (FileChannel ch = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buf = ByteBuffer.wrap(line);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(false);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public List<T> readSince(Instant since) {
        List<T> out = new ArrayList<>();
        for (T r : readAll()) {
            if (!timestamp.apply(r).isBefore(since)) out.add(r);
        }
        return out;
    }

    @Override
    public synchronized List<T> readAll() {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageCorruptedException("Cannot read " + path.toAbsolutePath(), e);
        }
        List<T> out = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String l = lines.get(i).trim();
            if (l.isEmpty()) continue;
            try {
                out.add(mapper.readValue(l, type));
            } catch (IOException e) {
                throw new StorageCorruptedException(
                        "Unreadable record at " + path.toAbsolutePath() + ":" + (i + 1), e);
            }
        }
        return out;
    }

    public Path path() {
        return path;
    }
}
