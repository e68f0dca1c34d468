package org.bpmn2drawio.transform;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Orthogonal routes between two shapes: leave through the side facing the
 * target, enter through the side facing the source, and bend twice at the
 * midpoint when the ends are offset on both axes.
 */
public class EdgeRouter {
    private static final double BEND_THRESHOLD = 10;

    /**
     * @return source point, bend points and target point, all in the shapes' coordinate space
     */
    public static List<Point> route(Bounds source, Bounds target) {
        double dx = target.centerX() - source.centerX();
        double dy = target.centerY() - source.centerY();

        Point start;
        Point end;
        boolean horizontal = Math.abs(dx) >= Math.abs(dy);
        if (horizontal) {
            start = dx >= 0 ? new Point(source.right(), source.centerY()) : new Point(source.x(), source.centerY());
            end = dx >= 0 ? new Point(target.x(), target.centerY()) : new Point(target.right(), target.centerY());
        } else {
            start = dy >= 0 ? new Point(source.centerX(), source.bottom()) : new Point(source.centerX(), source.y());
            end = dy >= 0 ? new Point(target.centerX(), target.y()) : new Point(target.centerX(), target.bottom());
        }

        List<Point> points = new ArrayList<>();
        points.add(start);
        if (Math.abs(start.x() - end.x()) > BEND_THRESHOLD && Math.abs(start.y() - end.y()) > BEND_THRESHOLD) {
            if (horizontal) {
                double midX = (start.x() + end.x()) / 2;
                points.add(new Point(midX, start.y()));
                points.add(new Point(midX, end.y()));
            } else {
                double midY = (start.y() + end.y()) / 2;
                points.add(new Point(start.x(), midY));
                points.add(new Point(end.x(), midY));
            }
        }
        points.add(end);
        return points;
    }
}
