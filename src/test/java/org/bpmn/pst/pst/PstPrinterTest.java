package org.bpmn.pst.pst;

import org.bpmn.pst.bpmn.models.GatewayKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PstPrinterTest {
    private static final PstNode SAMPLE = new PstNode.Sequence(List.of(
            new PstNode.Event("Start"),
            new PstNode.Task("Check (again)"),
            new PstNode.Task(" padded "),
            new PstNode.Branch(GatewayKind.EXCLUSIVE, "X|Approved?", List.of(
                    new PstNode.Loop(new PstNode.Task("B"), new PstNode.Task("Body_of_X|Approved?")),
                    new PstNode.Null())),
            new PstNode.Branch(GatewayKind.PARALLEL, "\tFork ", List.of(
                    new PstNode.Task("list[0]"),
                    new PstNode.Event("back\\slash"))),
            new PstNode.Loopback("Start")));

    @Test
    void shouldPrintIndentedLayout() {
        PstNode tree = new PstNode.Sequence(List.of(
                new PstNode.Task("a"),
                new PstNode.Branch(GatewayKind.EXCLUSIVE, null, List.of(new PstNode.Task("b")))));

        assertEquals("SEQ(\n  TASK(a),\n  XOR(\n    TASK(b),\n  ),\n)", PstPrinter.print(tree));
    }

    @Test
    void shouldPrintCompactLayout() {
        PstNode tree = new PstNode.Loop(new PstNode.Null(), new PstNode.Task("a"));

        assertEquals("LOOP(NULL(), TASK(a))", PstPrinter.printCompact(tree));
    }

    @Test
    void shouldEscapeReservedCharacters() {
        assertEquals("TASK(f\\(x\\) \\[1\\] \\\\)", PstPrinter.printCompact(new PstNode.Task("f(x) [1] \\")));
    }

    @Test
    void shouldEscapeWhitespaceAtLabelEdges() {
        assertEquals("TASK(\\ a b\\ )", PstPrinter.printCompact(new PstNode.Task(" a b ")));
        assertEquals("EVENT(\\ )", PstPrinter.printCompact(new PstNode.Event(" ")));
    }

    @Test
    void shouldPrintBranchLabel() {
        PstNode tree = new PstNode.Branch(GatewayKind.PARALLEL, "Fork", List.of(new PstNode.Task("a")));

        assertEquals("AND[Fork](TASK(a))", PstPrinter.printCompact(tree));
    }

    @Test
    void shouldParseBackWhatItPrints() {
        assertEquals(SAMPLE, PstParser.parse(PstPrinter.print(SAMPLE)));
        assertEquals(SAMPLE, PstParser.parse(PstPrinter.printCompact(SAMPLE)));
    }
}
