package io.coordmesh.coord;

import io.coordmesh.model.EventAction;
import io.coordmesh.model.EventRecord;
import io.coordmesh.security.SensitiveDataMasker;
import io.coordmesh.storage.RecordKind;
import io.coordmesh.storage.Store;
import io.coordmesh.util.Hashing;
import io.coordmesh.util.Jsons;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only, hash-chained audit trail of coordination actions.
 *
 * <p>Each row carries {@code prev_hash} (the previous row's hash, empty for the first row) and
 * {@code hash = sha256(compact row with hash=null)}. Detail values are masked before hashing,
 * so the stored row is exactly what was hashed.
 */
public final class EventLog {
    private final Store store;
    private final Clock clock;

    public EventLog(Store store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public synchronized EventRecord append(String agentId, EventAction action, String resource, Map<String, Object> detail) {
        Objects.requireNonNull(action, "action");
        EventRecord last = store.readLast(RecordKind.EVENTS, EventRecord.class).orElse(null);
        long nextId = last == null ? 1L : last.eventId() + 1L;
        String prevHash = last == null || last.hash() == null ? "" : last.hash();
        EventRecord unsigned = new EventRecord(
                nextId,
                clock.instant(),
                agentId,
                action,
                resource,
                SensitiveDataMasker.maskedDetail(detail),
                prevHash,
                null
        );
        EventRecord row = unsigned.withHash(hashOf(unsigned));
        store.append(RecordKind.EVENTS, row);
        return row;
    }

    /**
     * Newest-first page of events matching every given filter; {@code total_count} counts all matches.
     */
    public EventPage query(int limit, String agentId, EventAction action) {
        List<EventRecord> all = store.readLog(RecordKind.EVENTS, EventRecord.class);
        List<EventRecord> matches = new ArrayList<>();
        for (EventRecord event : all) {
            if (agentId != null && !agentId.isBlank() && !agentId.equals(event.agentId())) {
                continue;
            }
            if (action != null && action != event.action()) {
                continue;
            }
            matches.add(event);
        }
        Collections.reverse(matches);
        int safeLimit = Math.max(1, limit);
        List<EventRecord> page = matches.size() > safeLimit ? matches.subList(0, safeLimit) : matches;
        return new EventPage(List.copyOf(page), matches.size());
    }

    public ChainReport verify() {
        List<EventRecord> all = store.readLog(RecordKind.EVENTS, EventRecord.class);
        String expectedPrev = "";
        long expectedId = 1L;
        int checked = 0;
        for (EventRecord event : all) {
            checked++;
            boolean linked = expectedPrev.equals(event.prevHash()) && event.eventId() == expectedId;
            boolean intact = event.hash() != null && event.hash().equals(hashOf(event.withHash(null)));
            if (!linked || !intact) {
                return new ChainReport(false, checked, event.eventId());
            }
            expectedPrev = event.hash();
            expectedId++;
        }
        return new ChainReport(true, checked, null);
    }

    private static String hashOf(EventRecord unsigned) {
        return Hashing.sha256Hex(Jsons.toCompactJson(unsigned));
    }

    public record EventPage(List<EventRecord> events, int totalCount) {
    }

    public record ChainReport(boolean ok, int checked, Long firstBrokenEventId) {
    }
}
