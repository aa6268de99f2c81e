package org.bpmn.pst.pst;

import org.bpmn.pst.bpmn.models.GatewayKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PstParserTest {

    @Test
    void shouldParseNestedTree() {
        PstNode tree = PstParser.parse("SEQ(EVENT(Start), TASK(A|Check order), XOR(TASK(B), NULL()), LOOP(TASK(C), TASK(D)))");

        PstNode expected = new PstNode.Sequence(List.of(
                new PstNode.Event("Start"),
                new PstNode.Task("A|Check order"),
                new PstNode.Branch(GatewayKind.EXCLUSIVE, null, List.of(new PstNode.Task("B"), new PstNode.Null())),
                new PstNode.Loop(new PstNode.Task("C"), new PstNode.Task("D"))));
        assertEquals(expected, tree);
    }

    @Test
    void shouldAcceptIndentedLayoutWithTrailingCommas() {
        String text = "SEQ(\n"
                + "  TASK(A),\n"
                + "  AND[Gateway_1](\n"
                + "    TASK(B),\n"
                + "    TASK(C),\n"
                + "  ),\n"
                + ")\n";

        PstNode tree = PstParser.parse(text);

        PstNode expected = new PstNode.Sequence(List.of(
                new PstNode.Task("A"),
                new PstNode.Branch(GatewayKind.PARALLEL, "Gateway_1",
                        List.of(new PstNode.Task("B"), new PstNode.Task("C")))));
        assertEquals(expected, tree);
    }

    @Test
    void shouldReadNullWithArgument() {
        assertEquals(new PstNode.Null(), PstParser.parse("NULL(None)"));
    }

    @Test
    void shouldReadLoopback() {
        assertEquals(new PstNode.Loopback("A|Draft"), PstParser.parse("LOOPBACK( A|Draft )"));
    }

    @Test
    void shouldUnescapeLabels() {
        assertEquals(new PstNode.Task("a)b"), PstParser.parse("TASK(a\\)b)"));
        assertEquals(new PstNode.Task("back\\slash"), PstParser.parse("TASK(back\\\\slash)"));
    }

    @Test
    void shouldKeepEscapedWhitespaceAtLabelEdges() {
        assertEquals(new PstNode.Task(" padded "), PstParser.parse("TASK( \\ padded\\  )"));
        assertEquals(new PstNode.Task("a  b"), PstParser.parse("TASK(  a  b\n)"));
        assertEquals(new PstNode.Branch(GatewayKind.EXCLUSIVE, " X", List.of(new PstNode.Task("a"))),
                PstParser.parse("XOR[\\ X ](TASK(a))"));
    }

    @Test
    void shouldKeepBalancedParenthesesInLabel() {
        assertEquals(new PstNode.Task("Check (again)"), PstParser.parse("TASK(Check (again))"));
    }

    @Test
    void shouldReportUnknownKindWithPosition() {
        PstSyntaxException e = assertThrows(PstSyntaxException.class,
                () -> PstParser.parse("SEQ(\n  TASK(a),\n  FOO(b)\n)"));

        assertEquals(3, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getMessage().contains("FOO"));
    }

    @Test
    void shouldReportMissingClosingParenthesis() {
        PstSyntaxException e = assertThrows(PstSyntaxException.class, () -> PstParser.parse("SEQ(TASK(a)"));

        assertEquals(1, e.getLine());
        assertEquals(12, e.getColumn());
    }

    @Test
    void shouldRejectTrailingInput() {
        PstSyntaxException e = assertThrows(PstSyntaxException.class, () -> PstParser.parse("TASK(a) TASK(b)"));

        assertEquals(9, e.getColumn());
    }

    @Test
    void shouldRejectEmptyInteriorNode() {
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("SEQ()"));
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("XOR[X]( )"));
    }

    @Test
    void shouldRejectLoopWithoutExactlyTwoChildren() {
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("LOOP(TASK(a))"));
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("LOOP(TASK(a), TASK(b), TASK(c))"));
    }

    @Test
    void shouldRejectLabelOnNonBranch() {
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("SEQ[x](TASK(a))"));
    }

    @Test
    void shouldRejectEmptyInput() {
        PstSyntaxException e = assertThrows(PstSyntaxException.class, () -> PstParser.parse("   "));

        assertTrue(e.getMessage().contains("end of input"));
    }

    @Test
    void shouldRejectUnterminatedLeaf() {
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("TASK(abc"));
    }

    @Test
    void shouldEnforceDepthLimit() {
        assertDoesNotThrow(() -> PstParser.parse("SEQ(SEQ(TASK(a)))", 3));
        assertThrows(PstSyntaxException.class, () -> PstParser.parse("SEQ(SEQ(TASK(a)))", 2));
    }
}
