package org.bpmn.pst.pst;

/**
 * Raised when tree notation text does not match the grammar. Carries the 1-based position of the
 * offending character.
 */
public class PstSyntaxException extends IllegalArgumentException {
    private final int line;
    private final int column;

    public PstSyntaxException(String message, int line, int column) {
        super(String.format("%s (line %d, column %d)", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
