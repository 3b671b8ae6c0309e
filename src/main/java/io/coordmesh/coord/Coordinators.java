package io.coordmesh.coord;

import io.coordmesh.config.CoordSettings;
import io.coordmesh.project.ProjectHandle;
import io.coordmesh.project.ProjectResolver;
import io.coordmesh.storage.Store;
import io.coordmesh.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Opens one {@link Coordinator} per resolved project and reuses it for later calls.
 */
public final class Coordinators {
    private static final Logger log = LoggerFactory.getLogger(Coordinators.class);

    private final ProjectResolver resolver;
    private final CoordSettings settings;
    private final Clock clock;
    private final ConcurrentMap<String, Coordinator> byProject = new ConcurrentHashMap<>();

    public Coordinators(ProjectResolver resolver, CoordSettings settings, Clock clock) {
        this.resolver = resolver;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @throws CoordException {@code PROJECT_NOT_FOUND} if the resolver does not know the project
     */
    public Coordinator forProject(String projectId) {
        ProjectHandle handle = resolver.resolve(projectId);
        return byProject.computeIfAbsent(handle.id(), id -> open(handle));
    }

    private Coordinator open(ProjectHandle handle) {
        Store store = Stores.open(settings.storeBackend(), handle.rootPath());
        log.info("Opened project {} at {}", handle.id(), store.describe());
        return new Coordinator(handle, store, settings, clock);
    }
}
