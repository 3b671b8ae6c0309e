package io.coordmesh.tools;

import java.util.List;

public record ToolDefinition(String name, String description, List<String> required, List<String> optional) {
}
