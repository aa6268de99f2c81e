package org.bpmn.pst.bpmn.models;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only directed flow graph of one process.
 * Nodes keep document order; successor and predecessor lists keep the order of the edge list.
 */
public final class FlowGraph {
    private final String processId;
    private final Map<String, FlowNode> nodesById;
    private final List<SequenceFlow> flows;
    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;

    public FlowGraph(String processId, Collection<FlowNode> nodes, List<SequenceFlow> flows) {
        this.processId = processId;

        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate flow node id: " + node.id());
            }
        }

        Map<String, List<String>> succ = new LinkedHashMap<>();
        Map<String, List<String>> pred = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            succ.put(id, new ArrayList<>());
            pred.put(id, new ArrayList<>());
        }
        for (SequenceFlow flow : flows) {
            if (!byId.containsKey(flow.sourceRef())) {
                throw new IllegalArgumentException(String.format(
                        "Sequence flow '%s' references unknown source '%s'", flow.id(), flow.sourceRef()));
            }
            if (!byId.containsKey(flow.targetRef())) {
                throw new IllegalArgumentException(String.format(
                        "Sequence flow '%s' references unknown target '%s'", flow.id(), flow.targetRef()));
            }
            succ.get(flow.sourceRef()).add(flow.targetRef());
            pred.get(flow.targetRef()).add(flow.sourceRef());
        }

        succ.replaceAll((id, list) -> List.copyOf(list));
        pred.replaceAll((id, list) -> List.copyOf(list));

        this.nodesById = Collections.unmodifiableMap(byId);
        this.flows = List.copyOf(flows);
        this.successors = Collections.unmodifiableMap(succ);
        this.predecessors = Collections.unmodifiableMap(pred);
    }

    public String processId() {
        return processId;
    }

    public Map<String, FlowNode> nodesById() {
        return nodesById;
    }

    public List<SequenceFlow> flows() {
        return flows;
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public FlowNode node(String id) {
        FlowNode node = nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown flow node: " + id);
        }
        return node;
    }

    public List<String> successors(String id) {
        return successors.getOrDefault(id, List.of());
    }

    public List<String> predecessors(String id) {
        return predecessors.getOrDefault(id, List.of());
    }

    public NodeKind kindOf(String id) {
        return node(id).kind();
    }

    public String labelOf(String id) {
        return node(id).label();
    }

    public int outDegree(String id) {
        return successors(id).size();
    }

    public int inDegree(String id) {
        return predecessors(id).size();
    }

    /**
     * Picks the node structuring starts from: a start event without incoming flows, then any start
     * event, then any node without incoming flows, then the first node of the document.
     */
    public String selectStartNode() {
        if (nodesById.isEmpty()) {
            throw new IllegalArgumentException("Process '" + processId + "' has no flow nodes");
        }

        String anyStartEvent = null;
        for (FlowNode node : nodesById.values()) {
            if (!node.isStartEvent()) {
                continue;
            }
            if (inDegree(node.id()) == 0) {
                return node.id();
            }
            if (anyStartEvent == null) {
                anyStartEvent = node.id();
            }
        }
        if (anyStartEvent != null) {
            return anyStartEvent;
        }

        for (String id : nodesById.keySet()) {
            if (inDegree(id) == 0) {
                return id;
            }
        }
        return nodesById.keySet().iterator().next();
    }
}
