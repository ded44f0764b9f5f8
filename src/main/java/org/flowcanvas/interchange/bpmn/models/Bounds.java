package org.flowcanvas.interchange.bpmn.models;

/**
 * An axis-aligned box in document coordinates, as written in {@code dc:Bounds}.
 */
public record Bounds(double x, double y, double width, double height) {

    public static Bounds of(Point origin, Size size) {
        return new Bounds(origin.x(), origin.y(), size.width(), size.height());
    }

    public Point origin() {
        return new Point(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }
}
