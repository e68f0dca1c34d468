package org.bpmn2drawio.bpmn.models;

/**
 * Axis-aligned rectangle in diagram pixels. Whether the origin is the canvas or
 * a container depends on who holds it.
 */
public record Bounds(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public Point origin() {
        return new Point(x, y);
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }

    /**
     * Expresses these bounds relative to the given origin.
     */
    public Bounds relativeTo(Point parentOrigin) {
        return translate(-parentOrigin.x(), -parentOrigin.y());
    }

    /** Swaps the x and y axes (and width and height with them). */
    public Bounds transpose() {
        return new Bounds(y, x, height, width);
    }

    public boolean overlaps(Bounds other) {
        return x < other.right() && other.x < right()
                && y < other.bottom() && other.y < bottom();
    }

    public static Bounds union(Bounds a, Bounds b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        double minX = Math.min(a.x, b.x);
        double minY = Math.min(a.y, b.y);
        double maxX = Math.max(a.right(), b.right());
        double maxY = Math.max(a.bottom(), b.bottom());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }
}
