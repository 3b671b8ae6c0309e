package io.coordmesh.project;

import java.nio.file.Path;

public record ProjectHandle(String id, Path rootPath) {
}
