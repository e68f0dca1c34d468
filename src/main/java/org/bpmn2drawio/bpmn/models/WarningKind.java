package org.bpmn2drawio.bpmn.models;

public enum WarningKind {
    ORPHAN_ELEMENT("orphanElement"),
    DANGLING_FLOW("danglingFlow"),
    FLOW_TYPE_MISMATCH("flowTypeMismatch"),
    MISSING_TERMINAL_EVENT("missingTerminalEvent"),
    UNKNOWN_KIND("unknownKind"),
    MISSING_START_EVENT("missingStartEvent"),
    INVALID_LANE_REFERENCE("invalidLaneReference"),
    COLLAPSED_SUBPROCESS("collapsedSubprocess"),
    SCHEMA_VIOLATION("schemaViolation"),
    PRESERVE_WITHOUT_COORDINATES("preserveWithoutCoordinates"),
    DUPLICATE_ID("duplicateId"),
    OVERLAPPING_ELEMENTS("overlappingElements"),
    MISSING_LABEL("missingLabel");

    private final String code;

    WarningKind(String code) {
        this.code = code;
    }

    /** Name used in reports, e.g. {@code danglingFlow}. */
    public String code() {
        return code;
    }
}
