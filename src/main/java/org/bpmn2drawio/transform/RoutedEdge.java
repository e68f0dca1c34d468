package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.Point;

import java.util.List;

/**
 * A flow with its route. Edges inside one lane are expressed relative to that
 * lane; every other edge hangs off the canvas and uses absolute coordinates.
 *
 * @param containerId    lane holding the edge, null for the canvas
 * @param crossContainer endpoints are drawn in different containers
 * @param waypoints      bend points between source and target, in emitted coordinates
 */
public record RoutedEdge(
        Flow flow,
        String containerId,
        boolean crossContainer,
        Point absoluteSource,
        Point absoluteTarget,
        List<Point> absoluteWaypoints,
        Point source,
        Point target,
        List<Point> waypoints
) {
    public RoutedEdge {
        absoluteWaypoints = List.copyOf(absoluteWaypoints);
        waypoints = List.copyOf(waypoints);
    }
}
