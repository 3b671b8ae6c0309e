package io.coordmesh.project;

import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.coord.CoordErrorCode;
import io.coordmesh.coord.CoordException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Resolves projects to {@code <root>/projects/<id>}. The default project is created on demand;
 * any other project has to be created explicitly first.
 */
public final class DirectoryProjectResolver implements ProjectResolver {
    private final CoordMeshConfig config;

    public DirectoryProjectResolver(CoordMeshConfig config) {
        this.config = config;
    }

    @Override
    public ProjectHandle resolve(String projectId) {
        String id = projectId == null || projectId.isBlank()
                ? config.defaultProject()
                : CoordMeshConfig.sanitizeProjectId(projectId);
        Path root = config.projectRoot(id);
        if (Files.isDirectory(root)) {
            return new ProjectHandle(id, root);
        }
        if (id.equals(config.defaultProject())) {
            return create(id);
        }
        throw new CoordException(
                CoordErrorCode.PROJECT_NOT_FOUND,
                "Could not resolve project '" + projectId + "'. Create it with 'init --project' or omit project_id.",
                Map.of("project_id", projectId, "available", listProjectIds())
        );
    }

    public ProjectHandle create(String projectId) {
        String id = CoordMeshConfig.sanitizeProjectId(projectId);
        Path root = config.projectRoot(id);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw CoordException.storeFailure("Failed to create project directory: " + root, e);
        }
        return new ProjectHandle(id, root);
    }

    public List<String> listProjectIds() {
        Path dir = config.projectsDir();
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .forEach(out::add);
        } catch (IOException e) {
            throw CoordException.storeFailure("Failed to list projects under " + dir, e);
        }
        return out;
    }
}
