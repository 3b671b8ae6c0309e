package io.coordmesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class CoordSettingsTest {

    @Test
    void defaultsMatchHeartbeatCadence() {
        CoordSettings settings = CoordSettings.defaults();
        Assertions.assertEquals(600_000L, settings.leaseTtlMs());
        Assertions.assertEquals(180_000L, settings.stalenessTtlMs());
        Assertions.assertEquals(86_400_000L, settings.messageTtlMs());
        Assertions.assertEquals(20, settings.inboxLimit());
        Assertions.assertEquals(50, settings.logLimit());
        Assertions.assertEquals(CoordSettings.BACKEND_FILES, settings.storeBackend());
    }

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-settings-missing-");
        try {
            Assertions.assertEquals(CoordSettings.defaults(), CoordSettings.load(root.resolve("nope.json")));
        } finally {
            Files.deleteIfExists(root);
        }
    }

    @Test
    void fileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("coordmesh-test-settings-");
        Path file = root.resolve(CoordMeshConfig.SETTINGS_FILE);
        try {
            Files.writeString(file, """
                    {
                      "lease_ttl_ms": 30000,
                      "staleness_ttl_ms": 5,
                      "inbox_limit": 5000,
                      "max_limit": 100,
                      "store_backend": "SQLite",
                      "unknown_key": true
                    }
                    """, StandardCharsets.UTF_8);
            CoordSettings settings = CoordSettings.load(file);
            Assertions.assertEquals(30_000L, settings.leaseTtlMs());
            Assertions.assertEquals(CoordSettings.DEFAULT_STALENESS_TTL_MS, settings.stalenessTtlMs());
            Assertions.assertEquals(100, settings.inboxLimit());
            Assertions.assertEquals(CoordSettings.BACKEND_SQLITE, settings.storeBackend());
        } finally {
            Files.deleteIfExists(file);
            Files.deleteIfExists(root);
        }
    }

    @Test
    void unknownBackendIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CoordSettings.defaults().withStoreBackend("redis"));
    }

    @Test
    void limitsAreClamped() {
        CoordSettings settings = CoordSettings.defaults();
        Assertions.assertEquals(20, settings.clampLimit(null, 20));
        Assertions.assertEquals(20, settings.clampLimit(0, 20));
        Assertions.assertEquals(7, settings.clampLimit(7, 20));
        Assertions.assertEquals(1_000, settings.clampLimit(50_000, 20));
    }
}
