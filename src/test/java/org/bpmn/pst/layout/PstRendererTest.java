package org.bpmn.pst.layout;

import org.bpmn.pst.bpmn.models.EventRole;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.FlowNode;
import org.bpmn.pst.bpmn.models.GatewayKind;
import org.bpmn.pst.bpmn.models.NodeKind;
import org.bpmn.pst.bpmn.models.SequenceFlow;
import org.bpmn.pst.config.LayoutSettings;
import org.bpmn.pst.pst.PstNode;
import org.bpmn.pst.pst.PstParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PstRendererTest {
    private static final String ROUNDTRIP_TREE =
            "SEQ(EVENT(Start|Order received), TASK(A), XOR[X](TASK(B), TASK(C)), TASK(D), EVENT(End))";

    private final PstRenderer renderer = new PstRenderer(new LayoutSettings(), "Process_1", 256);

    @Test
    void shouldRenderSplitJoinRegion() {
        RenderedProcess rendered = renderer.render(PstParser.parse(ROUNDTRIP_TREE));
        FlowGraph graph = rendered.graph();

        assertEquals("Process_1", graph.processId());
        assertEquals(8, graph.nodesById().size());
        assertEquals(8, graph.flows().size());
        assertEquals(6, graph.nodesById().values().stream().filter(n -> n.kind() != NodeKind.GATEWAY).count());
        assertEquals(2, graph.nodesById().values().stream().filter(n -> n.isGateway(GatewayKind.EXCLUSIVE)).count());
        assertEquals(8, rendered.shapes().size());
        assertEquals(8, rendered.edges().size());
    }

    @Test
    void shouldAllocateIdsFromOneCounter() {
        RenderedProcess rendered = renderer.render(PstParser.parse(ROUNDTRIP_TREE));

        assertEquals(List.of("Event_1", "Task_2", "Split_4", "Task_5", "Task_7", "Join_9", "Task_13", "Event_15"),
                List.copyOf(rendered.graph().nodesById().keySet()));
        SequenceFlow first = rendered.graph().flows().get(0);
        assertEquals(new SequenceFlow("Flow_3", "Event_1", "Task_2"), first);
    }

    @Test
    void shouldStartEveryRenderWithFreshIds() {
        PstNode tree = PstParser.parse(ROUNDTRIP_TREE);

        RenderedProcess first = renderer.render(tree);
        RenderedProcess second = renderer.render(tree);

        assertEquals(first.graph().nodesById().keySet(), second.graph().nodesById().keySet());
        assertNotSame(first.graph(), second.graph());
    }

    @Test
    void shouldPlaceShapesLeftToRightAndFanOutBranches() {
        RenderedProcess rendered = renderer.render(PstParser.parse(ROUNDTRIP_TREE));

        assertEquals(new Bounds(100, 100, 36, 36), rendered.shapes().get("Event_1"));
        assertEquals(new Bounds(300, 100, 100, 80), rendered.shapes().get("Task_2"));
        assertEquals(new Bounds(500, 100, 50, 50), rendered.shapes().get("Split_4"));
        assertEquals(new Bounds(750, 0, 100, 80), rendered.shapes().get("Task_5"));
        assertEquals(new Bounds(750, 200, 100, 80), rendered.shapes().get("Task_7"));
        assertEquals(new Bounds(1000, 100, 50, 50), rendered.shapes().get("Join_9"));
        assertEquals(new Bounds(1200, 100, 100, 80), rendered.shapes().get("Task_13"));
        assertEquals(new Bounds(1400, 100, 36, 36), rendered.shapes().get("Event_15"));
    }

    @Test
    void shouldConnectRightCenterToLeftCenter() {
        RenderedProcess rendered = renderer.render(PstParser.parse(ROUNDTRIP_TREE));

        RenderedProcess.DiagramEdge edge = rendered.edges().get(0);
        assertEquals("Flow_3_di", edge.id());
        assertEquals("Flow_3", edge.flowId());
        assertEquals(List.of(new Waypoint(136, 118), new Waypoint(300, 140)), edge.waypoints());
    }

    @Test
    void shouldStackThreeBranchesSymmetrically() {
        RenderedProcess rendered = renderer.render(PstParser.parse("AND(TASK(a), TASK(b), TASK(c))"));

        assertEquals(-100, rendered.shapes().get("Task_2").y());
        assertEquals(100, rendered.shapes().get("Task_4").y());
        assertEquals(300, rendered.shapes().get("Task_6").y());
        FlowNode split = rendered.graph().node("Split_1");
        assertEquals("parallelGateway", split.elementType());
        assertEquals("AND", split.name());
    }

    @Test
    void shouldPushJoinPastWideBranch() {
        RenderedProcess rendered = renderer.render(PstParser.parse("XOR(SEQ(TASK(a), TASK(b), TASK(c)), TASK(d))"));

        // the sequence ends at x=850, the join keeps its gap after that
        Bounds join = rendered.shapes().get("Join_10");
        assertNotNull(join);
        assertEquals(1000, join.x());
    }

    @Test
    void shouldRenderLoopWithBackEdge() {
        RenderedProcess rendered = renderer.render(PstParser.parse("LOOP(TASK(c), TASK(b))"));

        assertEquals(new Bounds(100, 100, 100, 80), rendered.shapes().get("Task_1"));
        assertEquals(new Bounds(300, 200, 100, 80), rendered.shapes().get("Task_2"));
        assertEquals(List.of(
                new SequenceFlow("Flow_3", "Task_1", "Task_2"),
                new SequenceFlow("Flow_4", "Task_2", "Task_1")), rendered.graph().flows());
    }

    @Test
    void shouldResolveLoopbackToRenderedLeaf() {
        RenderedProcess rendered = renderer.render(PstParser.parse("SEQ(TASK(A), TASK(B), LOOPBACK(A))"));

        assertEquals(2, rendered.graph().nodesById().size());
        assertEquals(new SequenceFlow("Flow_4", "Task_2", "Task_1"), rendered.graph().flows().get(1));
    }

    @Test
    void shouldRenderUnknownLoopbackAsIntermediateEvent() {
        RenderedProcess rendered = renderer.render(PstParser.parse("SEQ(TASK(A), LOOPBACK(Elsewhere))"));

        FlowNode loopback = rendered.graph().node("Loopback_2");
        assertEquals(EventRole.INTERMEDIATE, loopback.eventRole());
        assertEquals("intermediateCatchEvent", loopback.elementType());
        assertEquals("Elsewhere", loopback.name());
    }

    @Test
    void shouldDeriveEventRoles() {
        RenderedProcess rendered = renderer.render(
                PstParser.parse("SEQ(EVENT(e1), EVENT(Timer), EVENT(e2), EVENT(Process started))"));
        FlowGraph graph = rendered.graph();

        assertEquals(EventRole.START, graph.node("Event_1").eventRole());
        assertEquals(EventRole.INTERMEDIATE, graph.node("Event_2").eventRole());
        assertEquals(EventRole.INTERMEDIATE, graph.node("Event_4").eventRole());
        // the label wins over the position
        assertEquals(EventRole.START, graph.node("Event_6").eventRole());
    }

    @Test
    void shouldRenderNullAsPlaceholderTask() {
        RenderedProcess rendered = renderer.render(new PstNode.Null());

        FlowNode placeholder = rendered.graph().node("Null_1");
        assertEquals(NodeKind.TASK, placeholder.kind());
        assertEquals("None", placeholder.name());
        assertEquals(new Bounds(100, 100, 80, 60), rendered.shapes().get("Null_1"));
        assertTrue(rendered.graph().flows().isEmpty());
    }

    @Test
    void shouldHonourLayoutSettings() {
        LayoutSettings layout = new LayoutSettings();
        layout.originX = 0;
        layout.sequencePitch = 150;

        RenderedProcess rendered = new PstRenderer(layout, "P", 256).render(PstParser.parse("SEQ(TASK(a), TASK(b))"));

        assertEquals(0, rendered.shapes().get("Task_1").x());
        assertEquals(150, rendered.shapes().get("Task_2").x());
    }

    @Test
    void shouldFailOnTooDeepTree() {
        PstRenderer shallow = new PstRenderer(new LayoutSettings(), "P", 1);

        assertThrows(IllegalStateException.class, () -> shallow.render(PstParser.parse("SEQ(TASK(a))")));
    }
}
