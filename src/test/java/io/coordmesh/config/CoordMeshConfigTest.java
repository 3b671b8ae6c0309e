package io.coordmesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

final class CoordMeshConfigTest {

    @Test
    void projectIdsAreSanitizedIntoSafeDirectoryNames() {
        Assertions.assertEquals("my-app", CoordMeshConfig.sanitizeProjectId("My App"));
        Assertions.assertEquals("a-b", CoordMeshConfig.sanitizeProjectId("a//b"));
        Assertions.assertEquals("p..", CoordMeshConfig.sanitizeProjectId(".."));
        Assertions.assertEquals(CoordMeshConfig.DEFAULT_PROJECT, CoordMeshConfig.sanitizeProjectId("  "));
        Assertions.assertEquals(CoordMeshConfig.DEFAULT_PROJECT, CoordMeshConfig.sanitizeProjectId("///"));
    }

    @Test
    void layoutIsRootedAtBaseDir() {
        CoordMeshConfig config = CoordMeshConfig.fromRoot("/tmp/coord-root");
        Assertions.assertEquals(Path.of("/tmp/coord-root/projects/web"), config.projectRoot("Web"));
        Assertions.assertEquals(Path.of("/tmp/coord-root/coordmesh-settings.json"), config.settingsFile());
        Assertions.assertEquals(CoordMeshConfig.DEFAULT_PROJECT, config.defaultProject());
    }
}
