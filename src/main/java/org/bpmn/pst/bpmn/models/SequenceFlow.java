package org.bpmn.pst.bpmn.models;

/**
 * Represents a BPMN SequenceFlow connecting two flow nodes.
 *
 * @param id        the unique identifier of the sequence flow
 * @param name      the name/label of the sequence flow, may be null
 * @param sourceRef id of the source flow node
 * @param targetRef id of the target flow node
 */
public record SequenceFlow(
        String id,
        String name,
        String sourceRef,
        String targetRef
) {
    // Constructor for unnamed flows
    public SequenceFlow(String id, String sourceRef, String targetRef) {
        this(id, null, sourceRef, targetRef);
    }
}
