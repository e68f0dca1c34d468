package org.bpmn2drawio.bpmn.models;

public enum LoopMarker {
    NONE,
    STANDARD,
    PARALLEL_MULTI_INSTANCE,
    SEQUENTIAL_MULTI_INSTANCE
}
