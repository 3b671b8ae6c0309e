package io.coordmesh.coord;

import io.coordmesh.model.EventAction;
import io.coordmesh.model.EventRecord;
import io.coordmesh.security.SensitiveDataMasker;
import io.coordmesh.storage.FileStore;
import io.coordmesh.storage.InMemoryStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class EventLogTest {

    @Test
    void eventsFormAVerifiableChain() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        EventLog log = new EventLog(new InMemoryStore(), clock);

        EventRecord first = log.append("a", EventAction.REGISTERED, null, Map.of("kind", "ai"));
        clock.advance(Duration.ofSeconds(1));
        EventRecord second = log.append("a", EventAction.LOCK_ACQUIRED, "src/x.ts", Map.of("remaining_ms", 600_000L));

        Assertions.assertEquals(1L, first.eventId());
        Assertions.assertEquals("", first.prevHash());
        Assertions.assertEquals(2L, second.eventId());
        Assertions.assertEquals(first.hash(), second.prevHash());
        Assertions.assertEquals(64, second.hash().length());

        EventLog.ChainReport report = log.verify();
        Assertions.assertTrue(report.ok());
        Assertions.assertEquals(2, report.checked());
        Assertions.assertNull(report.firstBrokenEventId());
    }

    @Test
    void verifyPinpointsTamperedRow() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-eventlog-tamper-");
        try {
            MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
            EventLog log = new EventLog(new FileStore(root), clock);
            log.append("a", EventAction.REGISTERED, null, Map.of());
            log.append("b", EventAction.REGISTERED, null, Map.of());
            log.append("c", EventAction.REGISTERED, null, Map.of());
            Assertions.assertTrue(log.verify().ok());

            Path file = root.resolve("events").resolve("events.jsonl");
            String original = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, original.replace("\"agent_id\":\"b\"", "\"agent_id\":\"mallory\""),
                    StandardCharsets.UTF_8);

            EventLog.ChainReport report = log.verify();
            Assertions.assertFalse(report.ok());
            Assertions.assertEquals(2L, report.firstBrokenEventId());
            Assertions.assertEquals(2, report.checked());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queryIsNewestFirstWithTotalCountBeforeLimit() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        EventLog log = new EventLog(new InMemoryStore(), clock);
        for (int i = 0; i < 5; i++) {
            log.append("a", EventAction.HEARTBEAT, null, Map.of("n", i));
            log.append("b", EventAction.HEARTBEAT, null, Map.of("n", i));
        }
        log.append("a", EventAction.LOCK_ACQUIRED, "r", Map.of());

        EventLog.EventPage page = log.query(3, "a", EventAction.HEARTBEAT);
        Assertions.assertEquals(5, page.totalCount());
        Assertions.assertEquals(3, page.events().size());
        Assertions.assertEquals(List.of(4, 3, 2), page.events().stream().map(e -> e.detail().get("n")).toList());

        EventLog.EventPage all = log.query(50, null, null);
        Assertions.assertEquals(11, all.totalCount());
        Assertions.assertEquals(EventAction.LOCK_ACQUIRED, all.events().get(0).action());
    }

    @Test
    void secretsInDetailAreMaskedBeforeHashing() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        EventLog log = new EventLog(new InMemoryStore(), clock);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("api_token", "abc");
        detail.put("note", "sk-live-0123456789abcdefghij");
        detail.put("resource", "src/auth.ts");
        log.append("a", EventAction.MESSAGE_SENT, "b", detail);

        EventRecord stored = log.query(1, null, null).events().get(0);
        Assertions.assertEquals(SensitiveDataMasker.MASK, stored.detail().get("api_token"));
        Assertions.assertEquals(SensitiveDataMasker.MASK, stored.detail().get("note"));
        Assertions.assertEquals("src/auth.ts", stored.detail().get("resource"));
        Assertions.assertTrue(log.verify().ok());
    }

    private static void deleteRecursively(Path root) throws IOException {
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
