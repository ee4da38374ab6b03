package com.astrepr;

/**
 * Thrown when AST-repr input cannot be turned into a tree at all: the input is empty,
 * its first line does not open a node, or the root is neither a {@code File} nor a
 * {@code Package} wrapping a {@code File}.
 *
 * Problems below the root never raise this exception; they are absorbed by the parser
 * and rendered as placeholders by the code generator.
 */
public class FormatException extends RuntimeException {

    private final int line;

    public FormatException(String message) {
        this(message, 0);
    }

    public FormatException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /**
     * 1-based line number the error refers to, or 0 when it is not tied to a line.
     */
    public int getLine() {
        return line;
    }
}
