package io.coordmesh.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.coordmesh.coord.CoordErrorCode;

import java.util.Map;

/**
 * Envelope returned by every tool call. Exactly one of {@code data} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(boolean ok, String tool, Object data, ToolError error) {

    public static ToolResult success(String tool, Object data) {
        return new ToolResult(true, tool, data, null);
    }

    public static ToolResult failure(String tool, CoordErrorCode code, String message, Map<String, Object> details) {
        return new ToolResult(false, tool, null, new ToolError(code, message, details == null ? Map.of() : details));
    }

    public record ToolError(CoordErrorCode code, String message, Map<String, Object> details) {
    }
}
