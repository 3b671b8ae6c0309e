package io.coordmesh.config;

import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Tunables read from {@code coordmesh-settings.json} at the coordination root. Missing or
 * out-of-range values fall back to the defaults below.
 */
public record CoordSettings(
        long leaseTtlMs,
        long stalenessTtlMs,
        long messageTtlMs,
        int inboxLimit,
        int logLimit,
        int maxLimit,
        String storeBackend
) {
    public static final long DEFAULT_LEASE_TTL_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_STALENESS_TTL_MS = 3L * DEFAULT_HEARTBEAT_INTERVAL_MS;
    public static final long DEFAULT_MESSAGE_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_INBOX_LIMIT = 20;
    public static final int DEFAULT_LOG_LIMIT = 50;
    public static final int DEFAULT_MAX_LIMIT = 1_000;
    public static final String BACKEND_FILES = "files";
    public static final String BACKEND_SQLITE = "sqlite";

    private static final Logger log = LoggerFactory.getLogger(CoordSettings.class);

    public static CoordSettings defaults() {
        return new CoordSettings(
                DEFAULT_LEASE_TTL_MS,
                DEFAULT_STALENESS_TTL_MS,
                DEFAULT_MESSAGE_TTL_MS,
                DEFAULT_INBOX_LIMIT,
                DEFAULT_LOG_LIMIT,
                DEFAULT_MAX_LIMIT,
                BACKEND_FILES
        );
    }

    public static CoordSettings load(Path file) {
        CoordSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            CoordSettings resolved = fromFile(raw, defaults);
            log.info("Loaded coordination settings from {}: {}", file, resolved);
            return resolved;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load coordination settings: " + file, e);
        }
    }

    static CoordSettings fromFile(SettingsFile file, CoordSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long leaseTtl = sanitizeLong(file.leaseTtlMs(), defaults.leaseTtlMs(), 1_000L);
        long staleness = sanitizeLong(file.stalenessTtlMs(), defaults.stalenessTtlMs(), 1_000L);
        long messageTtl = sanitizeLong(file.messageTtlMs(), defaults.messageTtlMs(), 1_000L);
        int maxLimit = sanitizeInt(file.maxLimit(), defaults.maxLimit(), 1);
        int inboxLimit = Math.min(maxLimit, sanitizeInt(file.inboxLimit(), defaults.inboxLimit(), 1));
        int logLimit = Math.min(maxLimit, sanitizeInt(file.logLimit(), defaults.logLimit(), 1));
        String backend = sanitizeBackend(file.storeBackend(), defaults.storeBackend());
        return new CoordSettings(leaseTtl, staleness, messageTtl, inboxLimit, logLimit, maxLimit, backend);
    }

    public Duration leaseTtl() {
        return Duration.ofMillis(leaseTtlMs);
    }

    public Duration stalenessTtl() {
        return Duration.ofMillis(stalenessTtlMs);
    }

    public Duration messageTtl() {
        return Duration.ofMillis(messageTtlMs);
    }

    public CoordSettings withStoreBackend(String backend) {
        return new CoordSettings(leaseTtlMs, stalenessTtlMs, messageTtlMs, inboxLimit, logLimit, maxLimit,
                sanitizeBackend(backend, storeBackend));
    }

    /**
     * Clamps a caller-supplied page size into {@code [1, max_limit]}.
     */
    public int clampLimit(Integer requested, int fallback) {
        if (requested == null || requested <= 0) {
            return fallback;
        }
        return Math.min(requested, maxLimit);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeBackend(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (BACKEND_FILES.equals(value) || BACKEND_SQLITE.equals(value)) {
            return value;
        }
        throw new IllegalArgumentException("Unknown store backend: " + raw + " (expected files|sqlite)");
    }

    record SettingsFile(
            Long leaseTtlMs,
            Long stalenessTtlMs,
            Long messageTtlMs,
            Integer inboxLimit,
            Integer logLimit,
            Integer maxLimit,
            String storeBackend
    ) {
    }
}
