package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EdgeRouterTest {
    private static final Bounds SOURCE = new Bounds(0, 0, 100, 80);

    @Test
    void shouldConnectFacingSidesInOneRow() {
        List<Point> route = EdgeRouter.route(SOURCE, new Bounds(200, 0, 100, 80));

        assertEquals(List.of(new Point(100, 40), new Point(200, 40)), route);
    }

    @Test
    void shouldBendAtMidpointWhenOffset() {
        List<Point> route = EdgeRouter.route(SOURCE, new Bounds(200, 100, 100, 80));

        assertEquals(List.of(new Point(100, 40), new Point(150, 40), new Point(150, 140), new Point(200, 140)), route);
    }

    @Test
    void shouldRouteVerticallyWhenTargetIsBelow() {
        List<Point> route = EdgeRouter.route(SOURCE, new Bounds(0, 200, 100, 80));

        assertEquals(List.of(new Point(50, 80), new Point(50, 200)), route);
    }

    @Test
    void shouldLeaveThroughLeftSideWhenTargetIsBehind() {
        List<Point> route = EdgeRouter.route(SOURCE, new Bounds(-200, 0, 100, 80));

        assertEquals(List.of(new Point(0, 40), new Point(-100, 40)), route);
    }

    @Test
    void shouldSkipBendsForSmallOffsets() {
        List<Point> route = EdgeRouter.route(SOURCE, new Bounds(200, 5, 100, 80));

        assertEquals(2, route.size());
    }
}
