package io.coordmesh.storage;

import java.util.List;
import java.util.Optional;

/**
 * Durable record persistence for one project.
 *
 * <p>Keyed collections ({@link RecordKind#AGENTS}, {@link RecordKind#LOCKS},
 * {@link RecordKind#MESSAGES}) support point reads and whole-record replacement. A write either
 * lands completely or not at all; readers never observe a torn record. {@link RecordKind#EVENTS}
 * only supports appends and ordered reads.
 *
 * <p>Implementations do not cache: every read goes to the backing medium, so a caller that
 * re-reads immediately before deciding sees the latest committed state.
 */
public interface Store {

    <T> Optional<T> read(RecordKind kind, String key, Class<T> type);

    /**
     * All records of a keyed collection, in no particular order.
     */
    <T> List<T> readAll(RecordKind kind, Class<T> type);

    void write(RecordKind kind, String key, Object record);

    /**
     * @return {@code true} if a record was removed
     */
    boolean delete(RecordKind kind, String key);

    void append(RecordKind kind, Object record);

    /**
     * Append-only collection in append order (oldest first).
     */
    <T> List<T> readLog(RecordKind kind, Class<T> type);

    <T> Optional<T> readLast(RecordKind kind, Class<T> type);

    /**
     * Human-readable location, for diagnostics.
     */
    String describe();

    static void requireKeyed(RecordKind kind) {
        if (kind.appendOnly()) {
            throw new IllegalArgumentException(kind + " is append-only");
        }
    }

    static void requireAppendOnly(RecordKind kind) {
        if (!kind.appendOnly()) {
            throw new IllegalArgumentException(kind + " is a keyed collection");
        }
    }
}
