package com.csg.airtel.csm4j.domain.constant;

public enum ResponseCodeEnum {

    SUCCESS("CSM-000", "Operation completed"),
    SESSION_NOT_FOUND("CSM-404", "Session not found"),
    SNAPSHOT_NOT_FOUND("CSM-405", "Snapshot not found"),
    SNAPSHOT_CORRUPTED("CSM-501", "Snapshot integrity check failed"),
    VALIDATION_ERROR("CSM-400", "Request or resource invariant validation failed"),
    INVALID_STATE_TRANSITION("CSM-409", "Session state does not allow this operation"),
    RESOURCE_EXHAUSTED("CSM-503", "Requested resources cannot be allocated"),
    CONTAINER_INIT_ERROR("CSM-502", "Container initialization failed"),
    EXCEPTION_CLIENT_LAYER("CSM-510", "Storage client failure"),
    INTERNAL_ERROR("CSM-500", "Internal server error");

    private final String code;
    private final String description;

    ResponseCodeEnum(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
