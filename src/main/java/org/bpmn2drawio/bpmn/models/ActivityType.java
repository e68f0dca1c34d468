package org.bpmn2drawio.bpmn.models;

public enum ActivityType {
    TASK("task"),
    USER("userTask"),
    SERVICE("serviceTask"),
    SCRIPT("scriptTask"),
    SEND("sendTask"),
    RECEIVE("receiveTask"),
    BUSINESS_RULE("businessRuleTask"),
    MANUAL("manualTask"),
    CALL_ACTIVITY("callActivity"),
    SUB_PROCESS("subProcess");

    private final String tag;

    ActivityType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ActivityType fromTag(String tag) {
        for (ActivityType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return null;
    }
}
