package org.bpmn2drawio.layout;

import org.bpmn2drawio.bpmn.models.Bounds;
import org.bpmn2drawio.bpmn.models.Point;

/**
 * Axis flips that turn a left-to-right drawing into the other directions.
 * Mirroring happens inside a range along one axis so the drawing keeps its
 * place on the canvas; transposition swaps axes around an origin.
 */
public final class DirectionTransform {

    private DirectionTransform() {
    }

    public static Bounds mirrorX(Bounds b, double start, double end) {
        return new Bounds(start + end - b.right(), b.y(), b.width(), b.height());
    }

    public static Bounds mirrorY(Bounds b, double start, double end) {
        return new Bounds(b.x(), start + end - b.bottom(), b.width(), b.height());
    }

    public static Point mirrorX(Point p, double start, double end) {
        return new Point(start + end - p.x(), p.y());
    }

    public static Point mirrorY(Point p, double start, double end) {
        return new Point(p.x(), start + end - p.y());
    }

    public static Bounds transpose(Bounds b, Point origin) {
        return b.relativeTo(origin).transpose().translate(origin.x(), origin.y());
    }

    public static Point transpose(Point p, Point origin) {
        return p.relativeTo(origin).transpose().translate(origin.x(), origin.y());
    }

    /**
     * Maps bounds drawn left to right inside {@code extent} to the given
     * direction. The result stays anchored at the extent's origin.
     */
    public static Bounds apply(Bounds b, Direction direction, Bounds extent) {
        return switch (direction) {
            case LR -> b;
            case RL -> mirrorX(b, extent.x(), extent.right());
            case TB -> transpose(b, extent.origin());
            case BT -> mirrorY(transpose(b, extent.origin()), extent.y(), extent.y() + extent.width());
        };
    }

    public static Point apply(Point p, Direction direction, Bounds extent) {
        return switch (direction) {
            case LR -> p;
            case RL -> mirrorX(p, extent.x(), extent.right());
            case TB -> transpose(p, extent.origin());
            case BT -> mirrorY(transpose(p, extent.origin()), extent.y(), extent.y() + extent.width());
        };
    }
}
