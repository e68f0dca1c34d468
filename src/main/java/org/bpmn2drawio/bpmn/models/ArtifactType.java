package org.bpmn2drawio.bpmn.models;

/**
 * Visual, non-flow elements. Reference tags map onto the same artifact as the
 * element they reference.
 */
public enum ArtifactType {
    DATA_OBJECT("dataObjectReference"),
    DATA_STORE("dataStoreReference"),
    TEXT_ANNOTATION("textAnnotation"),
    GROUP("group");

    private final String tag;

    ArtifactType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ArtifactType fromTag(String tag) {
        return switch (tag) {
            case "dataObjectReference" -> DATA_OBJECT;
            case "dataStoreReference", "dataStore" -> DATA_STORE;
            case "textAnnotation" -> TEXT_ANNOTATION;
            case "group" -> GROUP;
            default -> null;
        };
    }
}
