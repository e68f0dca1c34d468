package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a laid-out model (all bounds canvas-absolute) into the nesting
 * used by the target format: lanes relative to their pool, elements relative
 * to their lane, and edges relative to their lane only when both ends share it.
 * Every other edge is attached to the canvas with absolute points.
 */
public class CoordinateTransformer {
    private static final Logger log = LoggerFactory.getLogger(CoordinateTransformer.class);

    private static final double SELF_LOOP_OFFSET = 20;

    public static PlacedModel transform(ProcessModel model) {
        List<PlacedPool> pools = new ArrayList<>();
        List<PlacedLane> lanes = new ArrayList<>();
        Map<String, Bounds> laneOrigins = new HashMap<>();

        for (Pool pool : model.getPools()) {
            pools.add(new PlacedPool(pool, pool.getBounds()));
            for (Lane lane : pool.getLanes()) {
                Bounds absolute = lane.getBounds();
                lanes.add(new PlacedLane(lane, pool.getId(), absolute, absolute.relativeTo(pool.getBounds().origin())));
                laneOrigins.put(lane.getId(), absolute);
            }
        }

        // Boundary events go last so they are drawn on top of their hosts
        List<Element> ordered = new ArrayList<>();
        model.elements().stream().filter(e -> !e.isBoundaryEvent()).forEach(ordered::add);
        model.elements().stream().filter(Element::isBoundaryEvent).forEach(ordered::add);

        List<PlacedElement> elements = new ArrayList<>();
        Map<String, PlacedElement> placedById = new HashMap<>();
        for (Element element : ordered) {
            Bounds absolute = element.getBounds();
            String containerId = laneOrigins.containsKey(element.getLaneId()) ? element.getLaneId() : null;
            Bounds relative = containerId == null
                    ? absolute
                    : absolute.relativeTo(laneOrigins.get(containerId).origin());
            PlacedElement placed = new PlacedElement(element, containerId, absolute, relative);
            elements.add(placed);
            placedById.put(element.getId(), placed);
        }

        List<RoutedEdge> edges = new ArrayList<>();
        for (Flow flow : model.getFlows()) {
            PlacedElement source = placedById.get(flow.sourceRef());
            PlacedElement target = placedById.get(flow.targetRef());
            if (source == null || target == null) {
                // validation removes these, so this only happens when it was skipped
                log.warn("Flow {} skipped, endpoint not placed", flow.id());
                continue;
            }
            edges.add(routeEdge(flow, source, target, laneOrigins));
        }

        log.debug("Transformed {} pools, {} lanes, {} elements, {} edges",
                pools.size(), lanes.size(), elements.size(), edges.size());
        return new PlacedModel(pools, lanes, elements, edges);
    }

    static RoutedEdge routeEdge(Flow flow, PlacedElement source, PlacedElement target, Map<String, Bounds> laneOrigins) {
        List<Point> route = absoluteRoute(flow, source.absolute(), target.absolute());
        Point absoluteSource = route.get(0);
        Point absoluteTarget = route.get(route.size() - 1);
        List<Point> absoluteWaypoints = route.subList(1, route.size() - 1);

        boolean crossContainer = !Objects.equals(source.containerId(), target.containerId());
        String containerId = crossContainer ? null : source.containerId();

        if (containerId == null) {
            return new RoutedEdge(flow, null, crossContainer,
                    absoluteSource, absoluteTarget, absoluteWaypoints,
                    absoluteSource, absoluteTarget, absoluteWaypoints);
        }

        Point origin = laneOrigins.get(containerId).origin();
        List<Point> relativeWaypoints = new ArrayList<>();
        for (Point point : absoluteWaypoints) {
            relativeWaypoints.add(point.relativeTo(origin));
        }
        return new RoutedEdge(flow, containerId, false,
                absoluteSource, absoluteTarget, absoluteWaypoints,
                absoluteSource.relativeTo(origin), absoluteTarget.relativeTo(origin), relativeWaypoints);
    }

    /**
     * Input waypoints when the flow kept at least two of them, otherwise an
     * orthogonal route between the two shapes.
     */
    static List<Point> absoluteRoute(Flow flow, Bounds source, Bounds target) {
        if (flow.waypoints().size() >= 2) {
            return new ArrayList<>(flow.waypoints());
        }
        if (flow.sourceRef().equals(flow.targetRef())) {
            double right = source.right() + SELF_LOOP_OFFSET;
            double top = source.y() - SELF_LOOP_OFFSET;
            return List.of(
                    new Point(source.right(), source.centerY()),
                    new Point(right, source.centerY()),
                    new Point(right, top),
                    new Point(source.centerX(), top),
                    new Point(source.centerX(), source.y()));
        }
        return EdgeRouter.route(source, target);
    }
}
