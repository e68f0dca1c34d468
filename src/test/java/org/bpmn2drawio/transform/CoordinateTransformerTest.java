package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.BpmnHelper;
import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Flow;
import org.bpmn2drawio.bpmn.models.FlowKind;
import org.bpmn2drawio.bpmn.models.Point;
import org.bpmn2drawio.bpmn.models.ProcessModel;
import org.bpmn2drawio.layout.Direction;
import org.bpmn2drawio.layout.LayoutEngine;
import org.bpmn2drawio.layout.LayoutMode;
import org.bpmn2drawio.layout.PageSize;
import org.bpmn2drawio.validation.ModelValidator;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateTransformerTest {
    private static final Path LANES_BPMN = Path.of("src/test/resources/bpmn/lanes.bpmn");
    private static final Path TWO_POOLS_BPMN = Path.of("src/test/resources/bpmn/two_pools.bpmn");
    private static final Path ALL_KINDS_BPMN = Path.of("src/test/resources/bpmn/all_kinds.bpmn");
    private static final Path WITH_DI_BPMN = Path.of("src/test/resources/bpmn/with_di.bpmn");
    private static final List<Path> ALL_FIXTURES = List.of(
            Path.of("src/test/resources/bpmn/linear.bpmn"),
            Path.of("src/test/resources/bpmn/cycle.bpmn"),
            LANES_BPMN,
            TWO_POOLS_BPMN,
            WITH_DI_BPMN,
            ALL_KINDS_BPMN,
            Path.of("src/test/resources/bpmn/dangling_flow.bpmn"));

    @Test
    void shouldPutMessageFlowOnCanvasWithAbsolutePoints() {
        PlacedModel placed = transformed(TWO_POOLS_BPMN, LayoutMode.AUTO);

        RoutedEdge message = edge(placed, "Message_Order");
        assertNull(message.containerId());
        assertTrue(message.crossContainer());
        assertEquals(message.absoluteSource(), message.source());
        assertEquals(message.absoluteTarget(), message.target());
        assertEquals(message.absoluteWaypoints(), message.waypoints());
    }

    @Test
    void shouldKeepIntraLaneEdgeRelativeToLane() {
        PlacedModel placed = transformed(LANES_BPMN, LayoutMode.AUTO);
        Point laneOrigin = placed.lanesById().get("Lane_Customer").absolute().origin();

        RoutedEdge edge = edge(placed, "Flow_1");
        assertEquals("Lane_Customer", edge.containerId());
        assertFalse(edge.crossContainer());
        assertEquals(edge.absoluteSource().relativeTo(laneOrigin), edge.source());
        assertEquals(edge.absoluteTarget().relativeTo(laneOrigin), edge.target());
    }

    @Test
    void shouldPutCrossLaneEdgeOnCanvas() {
        PlacedModel placed = transformed(LANES_BPMN, LayoutMode.AUTO);

        RoutedEdge edge = edge(placed, "Flow_2");
        assertNull(edge.containerId());
        assertTrue(edge.crossContainer());
        assertEquals(edge.absoluteSource(), edge.source());
    }

    @Test
    void shouldExpressLanesAndElementsRelativeToParent() {
        PlacedModel placed = transformed(LANES_BPMN, LayoutMode.AUTO);

        PlacedPool pool = placed.pools().get(0);
        PlacedLane lane = placed.lanesById().get("Lane_System");
        assertEquals("Pool_Company", lane.poolId());
        assertEquals(lane.absolute().relativeTo(pool.absolute().origin()), lane.relative());
        assertEquals(40, placed.lanesById().get("Lane_Customer").relative().x());
        assertEquals(0, placed.lanesById().get("Lane_Customer").relative().y());

        PlacedElement task = placed.elementsById().get("Task_Process");
        assertEquals("Lane_System", task.containerId());
        assertFalse(task.onCanvas());
        assertEquals(task.absolute().relativeTo(lane.absolute().origin()), task.relative());
    }

    @Test
    void shouldKeepPoollessElementsAbsolute() {
        PlacedModel placed = transformed(WITH_DI_BPMN, LayoutMode.PRESERVE);

        PlacedElement task = placed.elementsById().get("Task_Approve");
        assertTrue(task.onCanvas());
        assertEquals(new Bounds(240, 80, 100, 80), task.relative());
    }

    @Test
    void shouldReuseInputWaypoints() {
        PlacedModel placed = transformed(WITH_DI_BPMN, LayoutMode.PRESERVE);

        RoutedEdge edge = edge(placed, "Flow_1");
        assertEquals(new Point(188, 120), edge.source());
        assertEquals(new Point(240, 120), edge.target());
        assertTrue(edge.waypoints().isEmpty());
    }

    @Test
    void shouldEmitBoundaryEventsLast() {
        PlacedModel placed = transformed(ALL_KINDS_BPMN, LayoutMode.AUTO);

        List<PlacedElement> elements = placed.elements();
        assertEquals("Boundary_Timer", elements.get(elements.size() - 1).element().getId());
        assertEquals(placed.elements().size(), placed.elementsById().size());
    }

    @Test
    void shouldExpressEveryEdgeInItsContainerFrame() {
        for (Path fixture : ALL_FIXTURES) {
            for (LayoutMode mode : LayoutMode.values()) {
                for (Direction direction : Direction.values()) {
                    String context = fixture.getFileName() + " " + mode + " " + direction;
                    PlacedModel placed = transformed(fixture, mode, direction);
                    Map<String, PlacedElement> elements = placed.elementsById();
                    Map<String, PlacedLane> lanes = placed.lanesById();

                    for (RoutedEdge edge : placed.edges()) {
                        String where = context + " " + edge.flow().id();
                        String sourceLane = elements.get(edge.flow().sourceRef()).containerId();
                        String targetLane = elements.get(edge.flow().targetRef()).containerId();

                        if (sourceLane == null || !sourceLane.equals(targetLane)) {
                            assertNull(edge.containerId(), where);
                            assertEquals(edge.absoluteSource(), edge.source(), where);
                            assertEquals(edge.absoluteTarget(), edge.target(), where);
                            assertEquals(edge.absoluteWaypoints(), edge.waypoints(), where);
                        } else {
                            assertEquals(sourceLane, edge.containerId(), where);
                            assertFalse(edge.crossContainer(), where);
                            Point origin = lanes.get(sourceLane).absolute().origin();
                            assertEquals(edge.absoluteSource().relativeTo(origin), edge.source(), where);
                            assertEquals(edge.absoluteTarget().relativeTo(origin), edge.target(), where);
                            for (int i = 0; i < edge.waypoints().size(); i++) {
                                assertEquals(edge.absoluteWaypoints().get(i).relativeTo(origin),
                                        edge.waypoints().get(i), where);
                            }
                        }
                    }
                }
            }
        }
    }

    @Test
    void shouldRouteSelfLoopAroundShape() {
        Flow loop = new Flow("Loop", null, FlowKind.SEQUENCE, "T", "T");

        List<Point> route = CoordinateTransformer.absoluteRoute(loop, new Bounds(0, 0, 100, 80), new Bounds(0, 0, 100, 80));

        assertEquals(5, route.size());
        assertEquals(new Point(100, 40), route.get(0));
        assertEquals(new Point(50, 0), route.get(4));
    }

    private static PlacedModel transformed(Path bpmn, LayoutMode mode) {
        return transformed(bpmn, mode, Direction.LR);
    }

    private static PlacedModel transformed(Path bpmn, LayoutMode mode, Direction direction) {
        ProcessModel model = BpmnHelper.parseBpmnFile(bpmn);
        ModelValidator.validate(model);
        LayoutEngine.layout(model, mode, direction, PageSize.AUTO);
        return CoordinateTransformer.transform(model);
    }

    private static RoutedEdge edge(PlacedModel placed, String flowId) {
        return placed.edges().stream().filter(e -> e.flow().id().equals(flowId)).findFirst()
                .orElseThrow(() -> new AssertionError("No edge " + flowId));
    }
}
