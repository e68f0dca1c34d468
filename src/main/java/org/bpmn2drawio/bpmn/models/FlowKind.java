package org.bpmn2drawio.bpmn.models;

public enum FlowKind {
    SEQUENCE,
    DEFAULT,
    CONDITIONAL,
    MESSAGE,
    ASSOCIATION;

    /** Sequence-like flows live inside one pool. */
    public boolean isSequenceLike() {
        return this == SEQUENCE || this == DEFAULT || this == CONDITIONAL;
    }

    /** Flows that imply an ordering between their endpoints. */
    public boolean isOrdering() {
        return this != ASSOCIATION;
    }
}
