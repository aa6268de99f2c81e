package org.bpmn.pst.bpmn.models;

/**
 * Coarse kind of a flow node as seen by the structuring engine.
 * All BPMN task flavours collapse into {@link #TASK}.
 */
public enum NodeKind {
    TASK,
    EVENT,
    GATEWAY
}
