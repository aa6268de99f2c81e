package org.bpmn.pst.pst;

/**
 * Writes trees in the parenthesized notation read by {@link PstParser}.
 */
public class PstPrinter {
    private static final String INDENT = "  ";

    /**
     * Multi-line layout: one node per line, children indented and each followed by a comma.
     */
    public static String print(PstNode node) {
        StringBuilder out = new StringBuilder();
        printIndented(node, 0, out);
        return out.toString();
    }

    /**
     * Single-line layout, e.g. {@code SEQ(TASK(a), TASK(b))}.
     */
    public static String printCompact(PstNode node) {
        StringBuilder out = new StringBuilder();
        printCompact(node, out);
        return out.toString();
    }

    private static void printIndented(PstNode node, int level, StringBuilder out) {
        String indent = INDENT.repeat(level);
        out.append(indent);
        if (node.type().isLeaf()) {
            appendLeaf(node, out);
            return;
        }
        appendHead(node, out);
        out.append("(\n");
        for (PstNode child : node.children()) {
            printIndented(child, level + 1, out);
            out.append(",\n");
        }
        out.append(indent).append(')');
    }

    private static void printCompact(PstNode node, StringBuilder out) {
        if (node.type().isLeaf()) {
            appendLeaf(node, out);
            return;
        }
        appendHead(node, out);
        out.append('(');
        boolean first = true;
        for (PstNode child : node.children()) {
            if (!first) {
                out.append(", ");
            }
            printCompact(child, out);
            first = false;
        }
        out.append(')');
    }

    private static void appendLeaf(PstNode node, StringBuilder out) {
        out.append(node.type().name()).append('(');
        if (node instanceof PstNode.Task task) {
            out.append(escape(task.label()));
        } else if (node instanceof PstNode.Event event) {
            out.append(escape(event.label()));
        } else if (node instanceof PstNode.Loopback loopback) {
            out.append(escape(loopback.targetLabel()));
        }
        out.append(')');
    }

    private static void appendHead(PstNode node, StringBuilder out) {
        out.append(node.type().name());
        if (node instanceof PstNode.Branch branch && branch.label() != null) {
            out.append('[').append(escape(branch.label())).append(']');
        }
    }

    static String escape(String label) {
        StringBuilder escaped = new StringBuilder(label.length());
        int last = label.length() - 1;
        for (int i = 0; i <= last; i++) {
            char c = label.charAt(i);
            boolean edgeWhitespace = (i == 0 || i == last) && Character.isWhitespace(c);
            if (edgeWhitespace || c == '\\' || c == '(' || c == ')' || c == '[' || c == ']') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
