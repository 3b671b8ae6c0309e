package io.coordmesh.storage;

import io.coordmesh.config.CoordSettings;

import java.nio.file.Path;

public final class Stores {
    public static final String DB_FILE = "coordmesh.db";

    private Stores() {
    }

    /**
     * Opens the configured backend rooted at a project's state directory.
     */
    public static Store open(String backend, Path stateRoot) {
        if (CoordSettings.BACKEND_SQLITE.equals(backend)) {
            Database database = new Database(stateRoot.resolve(DB_FILE));
            database.init();
            return new SqliteStore(database);
        }
        return new FileStore(stateRoot);
    }
}
