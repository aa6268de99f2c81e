package org.bpmn.pst.layout;

public record Waypoint(double x, double y) {
}
