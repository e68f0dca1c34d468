package org.bpmn2drawio.bpmn.models;

public enum Category {
    EVENT,
    ACTIVITY,
    GATEWAY,
    ARTIFACT,
    GENERIC
}
