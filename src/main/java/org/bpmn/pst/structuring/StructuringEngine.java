package org.bpmn.pst.structuring;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.FlowNode;
import org.bpmn.pst.bpmn.models.GatewayKind;
import org.bpmn.pst.pst.PstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recovers a Process Structure Tree from a flow graph.
 * <p>
 * The backbone walk follows the happy path from the start node and stops with a
 * {@link PstNode.Loopback} once it reaches a node it has already emitted. Every split found on the
 * way is expanded branch by branch up to its join. Inside a branch, an edge back to a split that is
 * still being expanded closes a {@link PstNode.Loop}; the loop body is not expanded again but
 * stands in as a single synthetic task named after that split.
 * <p>
 * Branches without a join are built unbounded and re-expand every split downstream of them, so the
 * tree can grow exponentially in the number of such splits. Besides the nesting depth, every call of
 * {@link #structureFrom(String)} is limited in the number of tree nodes it may emit. An engine
 * instance is not thread-safe.
 */
@Slf4j
public class StructuringEngine {
    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int DEFAULT_MAX_TREE_NODES = 100_000;
    static final String LOOP_BODY_PREFIX = "Body_of_";

    private final FlowGraph graph;
    private final JoinAnalyzer joinAnalyzer;
    private final int maxDepth;
    private final int maxTreeNodes;
    private int emittedNodes;

    public StructuringEngine(FlowGraph graph) {
        this(graph, DEFAULT_MAX_DEPTH, DEFAULT_MAX_TREE_NODES);
    }

    public StructuringEngine(FlowGraph graph, int maxDepth) {
        this(graph, maxDepth, DEFAULT_MAX_TREE_NODES);
    }

    public StructuringEngine(FlowGraph graph, int maxDepth, int maxTreeNodes) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        if (maxTreeNodes < 1) {
            throw new IllegalArgumentException("maxTreeNodes must be positive, was " + maxTreeNodes);
        }
        this.graph = graph;
        this.joinAnalyzer = new JoinAnalyzer(graph);
        this.maxDepth = maxDepth;
        this.maxTreeNodes = maxTreeNodes;
    }

    /**
     * Structures the graph starting from {@link FlowGraph#selectStartNode()}.
     */
    public PstNode structure() {
        return structureFrom(graph.selectStartNode());
    }

    public PstNode structureFrom(String startId) {
        if (!graph.contains(startId)) {
            throw new IllegalArgumentException("Unknown start node: " + startId);
        }
        log.debug("Structuring process '{}' from '{}'", graph.processId(), startId);
        emittedNodes = 0;

        List<PstNode> backbone = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        Set<String> emitted = new HashSet<>();
        pending.add(startId);

        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (!emitted.add(current)) {
                log.debug("Backbone returned to '{}', closing with a loopback", current);
                backbone.add(emit(new PstNode.Loopback(graph.labelOf(current))));
                break;
            }

            FlowNode node = graph.node(current);
            List<String> next = graph.successors(current);
            Optional<String> continuation = switch (node.kind()) {
                case TASK, EVENT -> {
                    backbone.add(leafOf(node));
                    if (next.size() > 1) {
                        yield continueAfterSplit(current, GatewayKind.EXCLUSIVE, backbone, List.of(), 1);
                    }
                    yield next.stream().findFirst();
                }
                case GATEWAY -> next.size() > 1
                        ? continueAfterSplit(current, node.gatewayKind(), backbone, List.of(), 1)
                        : next.stream().findFirst();
            };
            if (continuation.isEmpty()) {
                break;
            }
            pending.add(continuation.get());
        }

        return collapse(backbone);
    }

    /**
     * Walks one branch from {@code startId} up to, but excluding, {@code stopId}.
     *
     * @param stopId          the join bounding this branch, null when the split has none
     * @param enclosingSplits splits whose branches are being expanded, innermost last
     */
    PstNode buildBranch(String startId, String stopId, List<String> enclosingSplits, int depth) {
        checkDepth(depth);

        List<PstNode> collected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = startId;

        while (current != null && !current.equals(stopId) && seen.add(current)) {
            FlowNode node = graph.node(current);

            Optional<String> loopTarget = firstSuccessorIn(current, enclosingSplits);
            if (loopTarget.isPresent()) {
                return closeLoop(startId, loopTarget.get(), collected);
            }

            List<String> next = graph.successors(current);
            Optional<String> continuation = switch (node.kind()) {
                case TASK, EVENT -> {
                    collected.add(leafOf(node));
                    if (next.size() > 1) {
                        yield continueAfterSplit(current, GatewayKind.EXCLUSIVE, collected, enclosingSplits, depth + 1);
                    }
                    yield next.stream().findFirst();
                }
                case GATEWAY -> {
                    if (next.size() > 1) {
                        yield continueAfterSplit(current, node.gatewayKind(), collected, enclosingSplits, depth + 1);
                    }
                    yield next.stream().findFirst();
                }
            };
            current = continuation.orElse(null);
        }

        return collapse(collected);
    }

    /**
     * Expands the split into a branch node appended to {@code out} and returns where the walk goes
     * on: the first successor of the join, or nothing when the split has no usable join.
     */
    private Optional<String> continueAfterSplit(String splitId, GatewayKind kind, List<PstNode> out,
                                                List<String> enclosingSplits, int depth) {
        checkDepth(depth);

        Optional<String> join = joinAnalyzer.findJoin(splitId, kind)
                .filter(j -> !j.equals(splitId));
        String stopId = join.orElse(null);

        List<String> inner = new ArrayList<>(enclosingSplits);
        inner.add(splitId);
        List<String> branchSplits = List.copyOf(inner);

        List<PstNode> branches = new ArrayList<>();
        for (String branchStart : graph.successors(splitId)) {
            if (branchStart.equals(splitId) || branchStart.equals(stopId)) {
                branches.add(emit(new PstNode.Null()));
            } else {
                branches.add(buildBranch(branchStart, stopId, branchSplits, depth));
            }
        }
        out.add(emit(new PstNode.Branch(kind, graph.labelOf(splitId), branches)));

        return join.flatMap(j -> graph.successors(j).stream().findFirst());
    }

    /**
     * The node holding the back edge is not part of the condition; the condition is what the branch
     * collected before reaching it.
     */
    private PstNode closeLoop(String branchStartId, String splitId, List<PstNode> collected) {
        PstNode condition = collapse(collected);
        PstNode body = branchStartId.equals(splitId)
                ? new PstNode.Null()
                : new PstNode.Task(LOOP_BODY_PREFIX + graph.labelOf(splitId));
        emit(body);
        log.debug("Back edge to split '{}' closes a loop", splitId);
        return emit(new PstNode.Loop(condition, body));
    }

    private Optional<String> firstSuccessorIn(String id, List<String> enclosingSplits) {
        if (enclosingSplits.isEmpty()) {
            return Optional.empty();
        }
        return graph.successors(id).stream()
                .filter(enclosingSplits::contains)
                .findFirst();
    }

    private PstNode leafOf(FlowNode node) {
        return emit(switch (node.kind()) {
            case TASK -> new PstNode.Task(node.label());
            case EVENT -> new PstNode.Event(node.label());
            case GATEWAY -> throw new IllegalStateException("Gateway '" + node.id() + "' is not a leaf");
        });
    }

    /**
     * Collapses like {@link PstNode#collapse(List)}, counting the node it creates.
     */
    private PstNode collapse(List<PstNode> nodes) {
        PstNode collapsed = PstNode.collapse(nodes);
        if (nodes.size() != 1) {
            emit(collapsed);
        }
        return collapsed;
    }

    private <T extends PstNode> T emit(T node) {
        if (++emittedNodes > maxTreeNodes) {
            throw new IllegalStateException(String.format(
                    "Tree for process '%s' exceeds the maximum of %d nodes",
                    graph.processId(), maxTreeNodes));
        }
        return node;
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw new IllegalStateException(String.format(
                    "Split nesting in process '%s' exceeds the maximum depth of %d",
                    graph.processId(), maxDepth));
        }
    }
}
