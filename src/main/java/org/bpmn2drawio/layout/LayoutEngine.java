package org.bpmn2drawio.layout;

import org.bpmn2drawio.EmptyProcessException;
import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Element;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.Lane;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.bpmn.models.Pool;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.bpmn.models.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.bpmn2drawio.layout.LayoutConstants.LANE_PADDING;
import static org.bpmn2drawio.layout.LayoutConstants.MIN_LANE_EXTENT;
import static org.bpmn2drawio.layout.LayoutConstants.POOL_HEADER;
import static org.bpmn2drawio.layout.LayoutConstants.SLOT_GAP;

/**
 * Assigns canvas-absolute bounds to every element, lane and pool of a model.
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    /**
     * Lays out the model in place.
     *
     * @param model     validated model
     * @param mode      {@link LayoutMode#PRESERVE} keeps input coordinates when there are any
     * @param direction main flow direction
     * @param pageSize  soft wrapping width for rows of unconnected elements
     * @throws EmptyProcessException if the model has no elements
     */
    public static void layout(ProcessModel model, LayoutMode mode, Direction direction, PageSize pageSize) {
        if (model.elementCount() == 0) {
            throw new EmptyProcessException("Process contains no elements to lay out");
        }

        if (mode == LayoutMode.PRESERVE && !model.isHasExplicitCoordinates()) {
            log.warn("Preserve layout requested but the input has no diagram coordinates, using auto layout");
            model.warn(null, WarningKind.PRESERVE_WITHOUT_COORDINATES,
                    "Input has no diagram coordinates, automatic layout used instead");
            mode = LayoutMode.AUTO;
        }

        if (mode == LayoutMode.PRESERVE) {
            preserve(model, direction);
        } else if (model.isHasExplicitCoordinates()) {
            layoutAroundCoordinates(model, direction, pageSize);
        } else {
            clearWaypoints(model);
            new AutoLayout(model, direction, pageSize).run();
        }
        placeBoundaryEvents(model, model.isHasExplicitCoordinates());
        log.debug("Layout ({}, {}) done for {} elements", mode, direction, model.elementCount());
    }

    /**
     * Keeps the input coordinates and turns them to the given direction around
     * the diagram's bounding box. Elements and containers without coordinates
     * are placed next to the ones that have them.
     */
    static void preserve(ProcessModel model, Direction direction) {
        placeMissingElements(model, extentOf(model));
        deriveContainers(model);

        if (direction != Direction.LR) {
            Bounds box = extentOf(model);
            for (Element element : model.elements()) {
                if (element.hasBounds()) {
                    element.setBounds(DirectionTransform.apply(element.getBounds(), direction, box));
                }
            }
            for (Pool pool : model.getPools()) {
                pool.setBounds(DirectionTransform.apply(pool.getBounds(), direction, box));
                for (Lane lane : pool.getLanes()) {
                    lane.setBounds(DirectionTransform.apply(lane.getBounds(), direction, box));
                }
            }
            for (Flow flow : model.getFlows()) {
                List<Point> turned = new ArrayList<>();
                for (Point point : flow.waypoints()) {
                    turned.add(DirectionTransform.apply(point, direction, box));
                }
                flow.waypoints().clear();
                flow.waypoints().addAll(turned);
            }
        }
        for (Pool pool : model.getPools()) {
            pool.setHorizontal(!direction.isVertical());
        }
    }

    /**
     * Automatic layout for input that already carries coordinates. Elements with
     * coordinates keep them as drawn. The others are laid out on their own in
     * the given direction and the resulting block is put below the drawing.
     * When every element has coordinates this is a left-to-right preserve.
     */
    static void layoutAroundCoordinates(ProcessModel model, Direction direction, PageSize pageSize) {
        Map<Element, Bounds> given = new LinkedHashMap<>();
        List<Element> missing = new ArrayList<>();
        for (Element element : model.elements()) {
            if (element.hasBounds()) {
                given.put(element, element.getBounds());
            } else if (!hasHost(model, element)) {
                missing.add(element);
            }
        }
        if (missing.isEmpty()) {
            preserve(model, Direction.LR);
            return;
        }
        if (given.isEmpty()) {
            clearWaypoints(model);
            new AutoLayout(model, direction, pageSize).run();
            return;
        }

        Map<Pool, Bounds> givenPools = new LinkedHashMap<>();
        Map<Lane, Bounds> givenLanes = new LinkedHashMap<>();
        for (Pool pool : model.getPools()) {
            givenPools.put(pool, pool.getBounds());
            for (Lane lane : pool.getLanes()) {
                givenLanes.put(lane, lane.getBounds());
            }
        }
        Bounds drawing = null;
        for (Bounds bounds : given.values()) {
            drawing = Bounds.union(drawing, bounds);
        }
        for (Pool pool : model.getPools()) {
            drawing = Bounds.union(drawing, pool.getBounds());
        }

        clearWaypoints(model);
        new AutoLayout(model, direction, pageSize).run();

        Bounds block = null;
        for (Element element : missing) {
            block = Bounds.union(block, element.getBounds());
        }
        double dx = drawing.x() - block.x();
        double dy = drawing.bottom() + SLOT_GAP - block.y();
        for (Element element : missing) {
            element.setBounds(element.getBounds().translate(dx, dy));
        }
        for (Element element : model.elements()) {
            if (given.containsKey(element)) {
                element.setBounds(given.get(element));
            } else if (hasHost(model, element)) {
                element.setBounds(null);
            }
        }
        givenPools.forEach(Pool::setBounds);
        givenLanes.forEach(Lane::setBounds);
        deriveContainers(model);
        log.debug("Kept coordinates of {} elements, laid out {}", given.size(), missing.size());
    }

    private static void clearWaypoints(ProcessModel model) {
        for (Flow flow : model.getFlows()) {
            flow.waypoints().clear(); // input waypoints do not fit new positions
        }
    }

    static Bounds extentOf(ProcessModel model) {
        Bounds extent = null;
        for (Element element : model.elements()) {
            extent = Bounds.union(extent, element.getBounds());
        }
        for (Pool pool : model.getPools()) {
            extent = Bounds.union(extent, pool.getBounds());
            for (Lane lane : pool.getLanes()) {
                extent = Bounds.union(extent, lane.getBounds());
            }
        }
        return extent;
    }

    // Row below the drawing for elements the input gave no coordinates
    private static void placeMissingElements(ProcessModel model, Bounds extent) {
        double x = extent == null ? 0 : extent.x();
        double y = extent == null ? 0 : extent.bottom() + SLOT_GAP;
        for (Element element : model.elements()) {
            if (element.hasBounds() || hasHost(model, element)) {
                continue;
            }
            element.setBounds(new Bounds(x, y, element.width(), element.height()));
            x += element.width() + SLOT_GAP;
        }
    }

    /**
     * Fills in lane and pool bounds the input did not give, from the pool, the
     * sibling lanes or the member elements.
     */
    static void deriveContainers(ProcessModel model) {
        for (Pool pool : model.getPools()) {
            Map<Lane, Bounds> derived = new LinkedHashMap<>();
            for (Lane lane : pool.getLanes()) {
                if (lane.getBounds() != null) {
                    continue;
                }
                Bounds poolBounds = pool.getBounds();
                if (poolBounds != null && pool.getLanes().size() == 1) {
                    derived.put(lane, new Bounds(poolBounds.x() + POOL_HEADER, poolBounds.y(),
                            poolBounds.width() - POOL_HEADER, poolBounds.height()));
                    continue;
                }
                Bounds members = null;
                for (String elementId : lane.getElementIds()) {
                    members = Bounds.union(members, model.element(elementId).getBounds());
                }
                if (members != null) {
                    derived.put(lane, new Bounds(members.x() - LANE_PADDING, members.y() - LANE_PADDING,
                            members.width() + 2 * LANE_PADDING, members.height() + 2 * LANE_PADDING));
                }
            }
            derived.forEach(Lane::setBounds);

            if (pool.getBounds() == null) {
                Bounds lanes = null;
                for (Lane lane : pool.getLanes()) {
                    lanes = Bounds.union(lanes, lane.getBounds());
                }
                if (lanes != null) {
                    pool.setBounds(new Bounds(lanes.x() - POOL_HEADER, lanes.y(),
                            lanes.width() + POOL_HEADER, lanes.height()));
                } else {
                    pool.setBounds(new Bounds(0, 0, POOL_HEADER + MIN_LANE_EXTENT, MIN_LANE_EXTENT));
                }
            }

            // Lanes still without bounds are stacked at the bottom of the pool
            for (Lane lane : pool.getLanes()) {
                if (lane.getBounds() == null) {
                    Bounds poolBounds = pool.getBounds();
                    lane.setBounds(new Bounds(poolBounds.x() + POOL_HEADER, poolBounds.bottom(),
                            poolBounds.width() - POOL_HEADER, MIN_LANE_EXTENT));
                    pool.setBounds(new Bounds(poolBounds.x(), poolBounds.y(),
                            poolBounds.width(), poolBounds.height() + MIN_LANE_EXTENT));
                }
            }
        }
    }

    /**
     * True for a boundary event attached to an existing, non-boundary host.
     * Such events are positioned on the host instead of on their own.
     */
    static boolean hasHost(ProcessModel model, Element element) {
        if (!element.isBoundaryEvent()) {
            return false;
        }
        Element host = model.element(element.getAttachedToRef());
        return host != null && !host.isBoundaryEvent();
    }

    /**
     * Spreads boundary events along the bottom border of their host.
     *
     * @param keepExisting leave events that already have coordinates where they are
     */
    static void placeBoundaryEvents(ProcessModel model, boolean keepExisting) {
        Map<String, List<Element>> byHost = new LinkedHashMap<>();
        for (Element element : model.elements()) {
            if (!hasHost(model, element) || (keepExisting && element.hasBounds())) {
                continue;
            }
            byHost.computeIfAbsent(element.getAttachedToRef(), k -> new ArrayList<>()).add(element);
        }

        byHost.forEach((hostId, events) -> {
            Bounds host = model.element(hostId).getBounds();
            for (int i = 0; i < events.size(); i++) {
                Element event = events.get(i);
                double centerX = host.x() + host.width() * (i + 1) / (events.size() + 1);
                event.setBounds(new Bounds(centerX - event.width() / 2, host.bottom() - event.height() / 2,
                        event.width(), event.height()));
            }
        });
    }
}
