package io.coordmesh.storage;

import io.coordmesh.model.EventAction;
import io.coordmesh.model.EventRecord;
import io.coordmesh.model.LockRecord;
import org.junit.jupiter.api.Assertions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Checks shared by every {@link Store} backend.
 */
final class StoreContract {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private StoreContract() {
    }

    static void keyedRecordsReplaceAndDelete(Store store) {
        LockRecord first = new LockRecord("src/app.ts", "cymoril-code", T0, T0.plusSeconds(600), "refactor");
        store.write(RecordKind.LOCKS, first.resource(), first);
        Assertions.assertEquals(first, store.read(RecordKind.LOCKS, "src/app.ts", LockRecord.class).orElseThrow());

        LockRecord second = first.refreshed(T0.plusSeconds(900), null);
        store.write(RecordKind.LOCKS, first.resource(), second);
        Assertions.assertEquals(second, store.read(RecordKind.LOCKS, "src/app.ts", LockRecord.class).orElseThrow());

        store.write(RecordKind.LOCKS, "tool:deploy", new LockRecord("tool:deploy", "cymoril-test", T0, T0.plusSeconds(60), null));
        List<LockRecord> all = store.readAll(RecordKind.LOCKS, LockRecord.class);
        Assertions.assertEquals(2, all.size());
        Assertions.assertEquals(
                List.of("src/app.ts", "tool:deploy"),
                all.stream().map(LockRecord::resource).sorted(Comparator.naturalOrder()).toList()
        );

        Assertions.assertTrue(store.delete(RecordKind.LOCKS, "src/app.ts"));
        Assertions.assertFalse(store.delete(RecordKind.LOCKS, "src/app.ts"));
        Assertions.assertTrue(store.read(RecordKind.LOCKS, "src/app.ts", LockRecord.class).isEmpty());
        Assertions.assertTrue(store.readAll(RecordKind.AGENTS, LockRecord.class).isEmpty());
    }

    static void eventsAppendInOrder(Store store) {
        Assertions.assertTrue(store.readLast(RecordKind.EVENTS, EventRecord.class).isEmpty());
        for (long id = 1; id <= 3; id++) {
            store.append(RecordKind.EVENTS, new EventRecord(id, T0.plusSeconds(id), "agent-" + id,
                    EventAction.HEARTBEAT, null, Map.of("status", "active"), "", "h" + id));
        }
        List<EventRecord> log = store.readLog(RecordKind.EVENTS, EventRecord.class);
        Assertions.assertEquals(List.of(1L, 2L, 3L), log.stream().map(EventRecord::eventId).toList());
        Assertions.assertEquals(3L, store.readLast(RecordKind.EVENTS, EventRecord.class).orElseThrow().eventId());
        Assertions.assertEquals("active", log.get(0).detail().get("status"));
    }

    static void kindGuards(Store store) {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.write(RecordKind.EVENTS, "x", Map.of()));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.append(RecordKind.LOCKS, Map.of()));
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
