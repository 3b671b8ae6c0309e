package io.coordmesh.coord;

public enum CoordErrorCode {
    PROJECT_NOT_FOUND,
    AGENT_REQUIRED_FIELD_MISSING,
    LOCK_CONFLICT,
    UNLOCK_NOT_OWNER,
    MESSAGE_NOT_FOUND,
    MESSAGE_WRONG_RECIPIENT,
    INVALID_ARGUMENT,
    STORE_FAILURE
}
