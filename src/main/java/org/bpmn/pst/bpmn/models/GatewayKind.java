package org.bpmn.pst.bpmn.models;

/**
 * Gateway flavours the converter understands.
 * The short name is the keyword used by the tree notation.
 */
public enum GatewayKind {
    EXCLUSIVE("XOR", "exclusiveGateway"),
    PARALLEL("AND", "parallelGateway");

    private final String shortName;
    private final String elementType;

    GatewayKind(String shortName, String elementType) {
        this.shortName = shortName;
        this.elementType = elementType;
    }

    public String shortName() {
        return shortName;
    }

    public String elementType() {
        return elementType;
    }
}
