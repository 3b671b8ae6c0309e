package io.coordmesh.storage;

/**
 * One logical collection per record kind. {@link #EVENTS} is append-only.
 */
public enum RecordKind {
    AGENTS("agents", false),
    LOCKS("locks", false),
    MESSAGES("messages", false),
    EVENTS("events", true);

    private final String dirName;
    private final boolean appendOnly;

    RecordKind(String dirName, boolean appendOnly) {
        this.dirName = dirName;
        this.appendOnly = appendOnly;
    }

    public String dirName() {
        return dirName;
    }

    public boolean appendOnly() {
        return appendOnly;
    }
}
