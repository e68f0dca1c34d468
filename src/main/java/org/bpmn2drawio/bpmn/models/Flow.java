package org.bpmn2drawio.bpmn.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Directed edge between two elements. Waypoints come from DI and stay empty
 * when the input has none.
 */
public record Flow(
        String id,
        String name,
        FlowKind kind,
        String sourceRef,
        String targetRef,
        List<Point> waypoints
) {
    public Flow {
        name = name == null ? "" : name;
        waypoints = waypoints == null ? new ArrayList<>() : waypoints;
    }

    public Flow(String id, String name, FlowKind kind, String sourceRef, String targetRef) {
        this(id, name, kind, sourceRef, targetRef, new ArrayList<>());
    }
}
