package org.bpmn.pst.layout;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.models.EventRole;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.FlowNode;
import org.bpmn.pst.bpmn.models.GatewayKind;
import org.bpmn.pst.bpmn.models.SequenceFlow;
import org.bpmn.pst.config.LayoutSettings;
import org.bpmn.pst.pst.PstNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a Process Structure Tree into a new flow graph with shape bounds and connectors.
 * <p>
 * Sequences run left to right, branch children are stacked symmetrically around the split's row
 * between a split and a join gateway, and a loop places its body below and to the right of the
 * condition with a flow back to the condition.
 */
@Slf4j
public class PstRenderer {
    private final LayoutSettings layout;
    private final String processId;
    private final int maxDepth;

    public PstRenderer(LayoutSettings layout, String processId, int maxDepth) {
        this.layout = layout;
        this.processId = processId;
        this.maxDepth = maxDepth;
    }

    public RenderedProcess render(PstNode tree) {
        RenderRun run = new RenderRun();
        run.place(tree, layout.originX, layout.originY, 1);
        RenderedProcess rendered = run.finish();
        log.debug("Rendered {} flow nodes and {} sequence flows",
                rendered.graph().nodesById().size(), rendered.graph().flows().size());
        return rendered;
    }

    /**
     * Where a placed subtree is attached and where the next sibling goes.
     */
    record Placement(String entryId, String exitId, double nextX, double nextY) {
    }

    /**
     * Mutable state of one render call.
     */
    private final class RenderRun {
        private final IdAllocator ids = new IdAllocator();
        private final Map<String, PendingNode> nodes = new LinkedHashMap<>();
        private final List<SequenceFlow> flows = new ArrayList<>();
        private final Map<String, Bounds> shapes = new LinkedHashMap<>();
        private final List<Bounds> placed = new ArrayList<>();
        private final Map<String, String> leafIdsByLabel = new HashMap<>();

        Placement place(PstNode node, double x, double y, int depth) {
            if (depth > maxDepth) {
                throw new IllegalStateException("Tree nesting exceeds the maximum depth of " + maxDepth);
            }
            return switch (node.type()) {
                case TASK -> {
                    String label = ((PstNode.Task) node).label();
                    String id = addNode("Task", PendingKind.TASK, null, label.isEmpty() ? "Task" : label,
                            x, y, layout.taskWidth, layout.taskHeight);
                    leafIdsByLabel.putIfAbsent(label, id);
                    yield new Placement(id, id, x, y);
                }
                case EVENT -> {
                    String label = ((PstNode.Event) node).label();
                    String id = addNode("Event", PendingKind.EVENT, null, label.isEmpty() ? "Event" : label,
                            x, y, layout.eventSize, layout.eventSize);
                    leafIdsByLabel.putIfAbsent(label, id);
                    yield new Placement(id, id, x, y);
                }
                case NULL -> {
                    String id = addNode("Null", PendingKind.TASK, null, "None",
                            x, y, layout.nullWidth, layout.nullHeight);
                    yield new Placement(id, id, x, y);
                }
                case LOOPBACK -> placeLoopback((PstNode.Loopback) node, x, y);
                case SEQ -> placeSequence((PstNode.Sequence) node, x, y, depth);
                case XOR, AND -> placeBranch((PstNode.Branch) node, x, y, depth);
                case LOOP -> placeLoop((PstNode.Loop) node, x, y, depth);
            };
        }

        private Placement placeSequence(PstNode.Sequence sequence, double x, double y, int depth) {
            String firstEntry = null;
            String previousExit = null;
            double cursorX = x;
            double cursorY = y;
            for (PstNode child : sequence.children()) {
                Placement placement = place(child, cursorX, cursorY, depth + 1);
                if (previousExit != null) {
                    connect(previousExit, placement.entryId());
                }
                if (firstEntry == null) {
                    firstEntry = placement.entryId();
                }
                previousExit = placement.exitId();
                cursorX = placement.nextX() + layout.sequencePitch;
                cursorY = placement.nextY();
            }
            return new Placement(firstEntry, previousExit, cursorX, cursorY);
        }

        private Placement placeBranch(PstNode.Branch branch, double x, double y, int depth) {
            GatewayKind kind = branch.kind();
            String splitId = addNode("Split", PendingKind.GATEWAY, kind, kind.shortName(),
                    x, y, layout.gatewaySize, layout.gatewaySize);

            int count = branch.children().size();
            double childY = y - (count - 1) * layout.branchSpacing / 2;
            int firstChildShape = placed.size();
            List<String> exits = new ArrayList<>(count);
            for (PstNode child : branch.children()) {
                Placement placement = place(child, x + layout.branchOffset, childY, depth + 1);
                connect(splitId, placement.entryId());
                exits.add(placement.exitId());
                childY += layout.branchSpacing;
            }

            double joinX = Math.max(x + layout.joinOffset, rightmostSince(firstChildShape) + layout.joinGap);
            String joinId = addNode("Join", PendingKind.GATEWAY, kind, "Join",
                    joinX, y, layout.gatewaySize, layout.gatewaySize);
            for (String exit : exits) {
                connect(exit, joinId);
            }
            return new Placement(splitId, joinId, joinX, y);
        }

        private Placement placeLoop(PstNode.Loop loop, double x, double y, int depth) {
            int firstConditionShape = placed.size();
            Placement condition = place(loop.condition(), x, y, depth + 1);

            double bodyX = Math.max(x + layout.loopBodyOffsetX,
                    rightmostSince(firstConditionShape) + layout.loopBodyOffsetX - layout.taskWidth);
            int firstBodyShape = placed.size();
            Placement body = place(loop.body(), bodyX, y + layout.loopBodyOffsetY, depth + 1);

            connect(condition.exitId(), body.entryId());
            // back edge
            connect(body.exitId(), condition.entryId());

            double nextX = Math.max(x + 2 * layout.loopBodyOffsetX,
                    rightmostSince(firstBodyShape) + layout.loopBodyOffsetX - layout.taskWidth);
            return new Placement(condition.entryId(), condition.exitId(), nextX, y);
        }

        private Placement placeLoopback(PstNode.Loopback loopback, double x, double y) {
            String target = leafIdsByLabel.get(loopback.targetLabel());
            if (target != null) {
                return new Placement(target, target, x, y);
            }
            log.debug("Loopback target '{}' was not rendered, adding an intermediate event", loopback.targetLabel());
            String id = addNode("Loopback", PendingKind.LOOPBACK, null, loopback.targetLabel(),
                    x, y, layout.eventSize, layout.eventSize);
            return new Placement(id, id, x, y);
        }

        private String addNode(String prefix, PendingKind kind, GatewayKind gatewayKind, String name,
                               double x, double y, double width, double height) {
            String id = ids.next(prefix);
            nodes.put(id, new PendingNode(id, kind, gatewayKind, name));
            Bounds bounds = new Bounds(x, y, width, height);
            shapes.put(id, bounds);
            placed.add(bounds);
            return id;
        }

        private void connect(String sourceId, String targetId) {
            flows.add(new SequenceFlow(ids.next("Flow"), sourceId, targetId));
        }

        private double rightmostSince(int firstShape) {
            double right = Double.NEGATIVE_INFINITY;
            for (Bounds bounds : placed.subList(firstShape, placed.size())) {
                right = Math.max(right, bounds.right());
            }
            return right;
        }

        RenderedProcess finish() {
            Map<String, Integer> inDegree = new HashMap<>();
            Map<String, Integer> outDegree = new HashMap<>();
            for (SequenceFlow flow : flows) {
                outDegree.merge(flow.sourceRef(), 1, Integer::sum);
                inDegree.merge(flow.targetRef(), 1, Integer::sum);
            }

            List<FlowNode> flowNodes = new ArrayList<>(nodes.size());
            for (PendingNode pending : nodes.values()) {
                flowNodes.add(switch (pending.kind()) {
                    case TASK -> FlowNode.task(pending.id(), pending.name());
                    case GATEWAY -> FlowNode.gateway(pending.id(), pending.gatewayKind(), pending.name());
                    case EVENT -> FlowNode.event(pending.id(), eventRole(pending,
                            inDegree.getOrDefault(pending.id(), 0), outDegree.getOrDefault(pending.id(), 0)),
                            pending.name());
                    case LOOPBACK -> FlowNode.event(pending.id(), EventRole.INTERMEDIATE, pending.name());
                });
            }

            List<RenderedProcess.DiagramEdge> edges = new ArrayList<>();
            for (SequenceFlow flow : flows) {
                Bounds source = shapes.get(flow.sourceRef());
                Bounds target = shapes.get(flow.targetRef());
                if (source != null && target != null) {
                    edges.add(new RenderedProcess.DiagramEdge(flow.id() + "_di", flow.id(),
                            List.of(source.rightCenter(), target.leftCenter())));
                }
            }

            return new RenderedProcess(new FlowGraph(processId, flowNodes, flows), shapes, edges);
        }
    }

    /**
     * Event role from the label first ("start", "end"), then from where the event sits in the
     * rendered graph.
     */
    static EventRole eventRole(PendingNode event, int inDegree, int outDegree) {
        String name = event.name().toLowerCase(Locale.ROOT);
        if (name.contains("start")) {
            return EventRole.START;
        }
        if (name.contains("end")) {
            return EventRole.END;
        }
        if (inDegree == 0) {
            return EventRole.START;
        }
        if (outDegree == 0) {
            return EventRole.END;
        }
        return EventRole.INTERMEDIATE;
    }

    enum PendingKind {
        TASK,
        EVENT,
        GATEWAY,
        LOOPBACK
    }

    record PendingNode(String id, PendingKind kind, GatewayKind gatewayKind, String name) {
    }
}
