package org.bpmn.pst.bpmn.models;

import lombok.Builder;

/**
 * A task, event or gateway of a BPMN process.
 *
 * @param id          the element id, unique within the process
 * @param kind        coarse kind used for structuring
 * @param eventRole   role of an event, null for tasks and gateways
 * @param gatewayKind flavour of a gateway, null for tasks and events
 * @param name        the display name, may be null or blank
 * @param elementType the BPMN tag the node was read from, e.g. "userTask"
 */
@Builder
public record FlowNode(
        String id,
        NodeKind kind,
        EventRole eventRole,
        GatewayKind gatewayKind,
        String name,
        String elementType
) {
    public FlowNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Flow node id must not be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Flow node '" + id + "' has no kind");
        }
        if (kind == NodeKind.EVENT && eventRole == null) {
            throw new IllegalArgumentException("Event '" + id + "' has no role");
        }
        if (kind == NodeKind.GATEWAY && gatewayKind == null) {
            throw new IllegalArgumentException("Gateway '" + id + "' has no gateway kind");
        }
    }

    public static FlowNode task(String id, String name) {
        return new FlowNode(id, NodeKind.TASK, null, null, name, "task");
    }

    public static FlowNode event(String id, EventRole role, String name) {
        String elementType = switch (role) {
            case START -> "startEvent";
            case END -> "endEvent";
            case INTERMEDIATE -> "intermediateCatchEvent";
        };
        return new FlowNode(id, NodeKind.EVENT, role, null, name, elementType);
    }

    public static FlowNode gateway(String id, GatewayKind gatewayKind, String name) {
        return new FlowNode(id, NodeKind.GATEWAY, null, gatewayKind, name, gatewayKind.elementType());
    }

    /**
     * Label used in tree leaves: "id|name" when a name is present, the bare id otherwise.
     */
    public String label() {
        if (name != null && !name.isBlank()) {
            return id + "|" + name.strip();
        }
        return id;
    }

    public boolean isStartEvent() {
        return kind == NodeKind.EVENT && eventRole == EventRole.START;
    }

    public boolean isGateway(GatewayKind expected) {
        return kind == NodeKind.GATEWAY && gatewayKind == expected;
    }
}
