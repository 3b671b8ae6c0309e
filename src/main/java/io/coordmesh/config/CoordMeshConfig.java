package io.coordmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class CoordMeshConfig {
    public static final String DEFAULT_PROJECT = "default";
    public static final String DEFAULT_PROJECTS_DIR = "projects";
    public static final String SETTINGS_FILE = "coordmesh-settings.json";

    private final Path baseDir;
    private final String defaultProject;

    public CoordMeshConfig(Path baseDir, String defaultProject) {
        this.baseDir = baseDir;
        this.defaultProject = defaultProject;
    }

    public static CoordMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_PROJECT);
    }

    public static CoordMeshConfig fromRoot(String root, String defaultProject) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(".coordmesh")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new CoordMeshConfig(base, sanitizeProjectId(defaultProject));
    }

    /**
     * Maps a caller-supplied project id onto a safe directory name.
     */
    public static String sanitizeProjectId(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_PROJECT : raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_PROJECT;
        }
        if (value.startsWith(".")) {
            value = "p" + value;
        }
        return value;
    }

    public Path baseDir() {
        return baseDir;
    }

    public String defaultProject() {
        return defaultProject;
    }

    public Path projectsDir() {
        return baseDir.resolve(DEFAULT_PROJECTS_DIR);
    }

    public Path projectRoot(String projectId) {
        return projectsDir().resolve(sanitizeProjectId(projectId));
    }

    public Path settingsFile() {
        return baseDir.resolve(SETTINGS_FILE);
    }
}
