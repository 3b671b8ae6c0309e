package io.coordmesh.project;

/**
 * Maps an optional caller-supplied project id onto the directory that holds its coordination state.
 */
public interface ProjectResolver {

    /**
     * @param projectId project id, or {@code null}/blank for the default project
     * @throws io.coordmesh.coord.CoordException with {@code PROJECT_NOT_FOUND} when the id is unknown
     */
    ProjectHandle resolve(String projectId);
}
