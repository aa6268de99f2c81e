package org.bpmn.pst.pst;

import org.bpmn.pst.bpmn.models.GatewayKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent reader for the tree notation.
 *
 * <pre>
 * node   := KEYWORD label? '(' body ')'
 * label  := '[' text ']'                      (XOR and AND only)
 * body   := text                              (TASK, EVENT, NULL, LOOPBACK)
 *         | node (',' node)* ','?             (SEQ, XOR, AND, LOOP)
 * </pre>
 *
 * A backslash escapes the next character inside text. Unescaped parentheses inside a leaf text
 * must be balanced.
 */
public class PstParser {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final String text;
    private final int maxDepth;
    private int pos;

    private PstParser(String text, int maxDepth) {
        this.text = text;
        this.maxDepth = maxDepth;
    }

    public static PstNode parse(String text) {
        return parse(text, DEFAULT_MAX_DEPTH);
    }

    public static PstNode parse(String text, int maxDepth) {
        if (text == null) {
            throw new IllegalArgumentException("Tree text must not be null");
        }
        PstParser parser = new PstParser(text, maxDepth);
        parser.skipWhitespace();
        PstNode root = parser.parseNode(1);
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected trailing input '" + parser.peek() + "'");
        }
        return root;
    }

    private PstNode parseNode(int depth) {
        if (depth > maxDepth) {
            throw error("Tree nesting deeper than " + maxDepth);
        }
        int keywordStart = pos;
        String keyword = readKeyword();
        PstType type = PstType.fromKeyword(keyword)
                .orElseThrow(() -> errorAt(keywordStart, "Unknown node kind '" + keyword + "'"));

        skipWhitespace();
        String branchLabel = null;
        if (!atEnd() && peek() == '[') {
            if (type != PstType.XOR && type != PstType.AND) {
                throw error(type + " does not take a label");
            }
            pos++;
            branchLabel = readText(']');
            expect(']');
            skipWhitespace();
        }
        expect('(');

        if (type.isLeaf()) {
            String value = readText(')');
            expect(')');
            return leaf(type, value);
        }

        int bodyStart = pos;
        List<PstNode> children = parseChildren(depth);
        expect(')');
        return switch (type) {
            case SEQ -> {
                requireChildren(children, type, bodyStart);
                yield new PstNode.Sequence(children);
            }
            case XOR -> {
                requireChildren(children, type, bodyStart);
                yield new PstNode.Branch(GatewayKind.EXCLUSIVE, branchLabel, children);
            }
            case AND -> {
                requireChildren(children, type, bodyStart);
                yield new PstNode.Branch(GatewayKind.PARALLEL, branchLabel, children);
            }
            case LOOP -> {
                if (children.size() != 2) {
                    throw errorAt(bodyStart, "LOOP needs exactly a condition and a body, found "
                            + children.size() + " children");
                }
                yield new PstNode.Loop(children.get(0), children.get(1));
            }
            case TASK, EVENT, NULL, LOOPBACK -> throw new IllegalStateException("Leaf handled above: " + type);
        };
    }

    private List<PstNode> parseChildren(int depth) {
        List<PstNode> children = new ArrayList<>();
        skipWhitespace();
        while (!atEnd() && peek() != ')') {
            children.add(parseNode(depth + 1));
            skipWhitespace();
            if (atEnd() || peek() != ',') {
                break;
            }
            pos++;
            skipWhitespace();
        }
        return children;
    }

    private static PstNode leaf(PstType type, String value) {
        return switch (type) {
            case TASK -> new PstNode.Task(value);
            case EVENT -> new PstNode.Event(value);
            case NULL -> new PstNode.Null();
            case LOOPBACK -> new PstNode.Loopback(value);
            case SEQ, XOR, AND, LOOP -> throw new IllegalStateException("Not a leaf: " + type);
        };
    }

    private void requireChildren(List<PstNode> children, PstType type, int bodyStart) {
        if (children.isEmpty()) {
            throw errorAt(bodyStart, type + " needs at least one child");
        }
    }

    private String readKeyword() {
        int start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        if (start == pos) {
            throw atEnd() ? error("Expected a node but reached end of input")
                    : error("Expected a node kind but found '" + peek() + "'");
        }
        return text.substring(start, pos);
    }

    /**
     * Reads raw text up to the unescaped, unnested {@code terminator}, which is left unread.
     */
    private String readText(char terminator) {
        int start = pos;
        StringBuilder value = new StringBuilder();
        // unescaped whitespace at either end is layout, escaped whitespace is kept
        int kept = 0;
        int nesting = 0;
        while (!atEnd()) {
            char c = peek();
            if (c == '\\') {
                pos++;
                if (atEnd()) {
                    throw error("Dangling escape character");
                }
                value.append(peek());
                kept = value.length();
                pos++;
                continue;
            }
            if (c == terminator && nesting == 0) {
                value.setLength(kept);
                return value.toString();
            }
            if (Character.isWhitespace(c)) {
                if (value.length() > 0) {
                    value.append(c);
                }
                pos++;
                continue;
            }
            if (c == '(') {
                nesting++;
            } else if (c == ')') {
                nesting--;
            }
            value.append(c);
            kept = value.length();
            pos++;
        }
        throw errorAt(start, "Unterminated text, expected '" + terminator + "'");
    }

    private void expect(char expected) {
        if (atEnd()) {
            throw error("Expected '" + expected + "' but reached end of input");
        }
        if (peek() != expected) {
            throw error("Expected '" + expected + "' but found '" + peek() + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private PstSyntaxException error(String message) {
        return errorAt(pos, message);
    }

    private PstSyntaxException errorAt(int offset, String message) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new PstSyntaxException(message, line, column);
    }
}
