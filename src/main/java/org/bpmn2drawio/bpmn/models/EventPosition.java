package org.bpmn2drawio.bpmn.models;

/**
 * Where an event sits in the process, one per BPMN event tag.
 */
public enum EventPosition {
    START("startEvent"),
    END("endEvent"),
    INTERMEDIATE_CATCH("intermediateCatchEvent"),
    INTERMEDIATE_THROW("intermediateThrowEvent"),
    BOUNDARY("boundaryEvent");

    private final String tag;

    EventPosition(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static EventPosition fromTag(String tag) {
        for (EventPosition position : values()) {
            if (position.tag.equals(tag)) {
                return position;
            }
        }
        return null;
    }
}
