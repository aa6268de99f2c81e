package org.bpmn.pst.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Geometry used when a tree is rendered back into a diagram. All values are in diagram units.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutSettings {
    public double originX = 100;
    public double originY = 100;

    public double taskWidth = 100;
    public double taskHeight = 80;
    public double eventSize = 36;
    public double nullWidth = 80;
    public double nullHeight = 60;
    public double gatewaySize = 50;

    /**
     * Horizontal advance after each child of a sequence.
     */
    public double sequencePitch = 200;

    /**
     * Distance from a split to its branch children.
     */
    public double branchOffset = 250;

    /**
     * Minimum distance from a split to its join.
     */
    public double joinOffset = 500;

    /**
     * Free space kept between the widest branch child and the join.
     */
    public double joinGap = 150;

    /**
     * Vertical distance between stacked branch children.
     */
    public double branchSpacing = 200;

    public double loopBodyOffsetX = 200;
    public double loopBodyOffsetY = 100;
}
