package com.example.retrain.store;

import java.time.Instant;
import java.util.List;

/**
 * Durable, ordered, append-only record log. Records are never rewritten or removed.
 * <p>
 * Implementations must make an appended record visible to subsequent reads
 * before {@link #append} returns, and must throw {@link StorageCorruptedException}
 * rather than skip a record they cannot read.
 *
 * @param <T> record type
 */
public interface AppendOnlyLog<T> {

    void append(T record);

    /** Records whose timestamp is at or after {@code since}, in append order. */
    List<T> readSince(Instant since);

    List<T> readAll();
}
