package org.bpmn.pst.layout;

/**
 * Axis-aligned shape box, (x, y) being the top-left corner.
 */
public record Bounds(double x, double y, double width, double height) {

    public Waypoint rightCenter() {
        return new Waypoint(x + width, y + height / 2);
    }

    public Waypoint leftCenter() {
        return new Waypoint(x, y + height / 2);
    }

    public double right() {
        return x + width;
    }
}
