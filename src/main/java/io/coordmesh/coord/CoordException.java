package io.coordmesh.coord;

import java.util.List;
import java.util.Map;

/**
 * Caller-recoverable coordination failure. The tool layer turns it into a structured error result.
 */
public class CoordException extends RuntimeException {
    private final CoordErrorCode code;
    private final Map<String, Object> details;

    public CoordException(CoordErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public CoordException(CoordErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public CoordException(CoordErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : details;
    }

    public CoordErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    public static CoordException missingField(String field) {
        return new CoordException(
                CoordErrorCode.AGENT_REQUIRED_FIELD_MISSING,
                "Missing required field: " + field,
                Map.of("field", field)
        );
    }

    public static CoordException missingFields(List<String> fields) {
        if (fields.size() == 1) {
            return missingField(fields.get(0));
        }
        return new CoordException(
                CoordErrorCode.AGENT_REQUIRED_FIELD_MISSING,
                "Missing required fields: " + String.join(", ", fields),
                Map.of("fields", List.copyOf(fields))
        );
    }

    public static CoordException storeFailure(String message, Throwable cause) {
        return new CoordException(CoordErrorCode.STORE_FAILURE, message, Map.of(), cause);
    }
}
