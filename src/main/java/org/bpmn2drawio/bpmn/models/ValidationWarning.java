package org.bpmn2drawio.bpmn.models;

/**
 * A recoverable problem found (and possibly repaired) while converting.
 *
 * @param elementId id of the affected element or flow, null for model-wide issues
 */
public record ValidationWarning(String elementId, WarningKind kind, String message) {

    @Override
    public String toString() {
        return "[" + kind.code() + "] " + (elementId != null ? elementId + ": " : "") + message;
    }
}
