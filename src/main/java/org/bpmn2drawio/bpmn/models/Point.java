package org.bpmn2drawio.bpmn.models;

public record Point(double x, double y) {

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point relativeTo(Point parentOrigin) {
        return translate(-parentOrigin.x(), -parentOrigin.y());
    }

    public Point transpose() {
        return new Point(y, x);
    }
}
