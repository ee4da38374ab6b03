package com.astrepr;

/**
 * Structural token produced by {@link LineClassifier} for a single line of AST-repr text.
 */
public sealed interface LineToken permits
    LineToken.Comment,
    LineToken.Close,
    LineToken.ListEnd,
    LineToken.ListStart,
    LineToken.NodeOpen,
    LineToken.InlineNode,
    LineToken.KeyValue {

    /** Blank line, comment-only line, or anything unrecognized. */
    record Comment() implements LineToken {}

    /** A lone <code>}</code> closing the current node body. */
    record Close() implements LineToken {}

    /** A lone <code>]</code> closing the current list body. */
    record ListEnd() implements LineToken {}

    /** {@code name: [} or {@code name [}. */
    record ListStart(String key) implements LineToken {}

    /** <code>Kind: label {</code> opening a node body. */
    record NodeOpen(String kind, String label) implements LineToken {}

    /**
     * <code>Kind: label { body }</code> on a single line. The body has already been classified
     * and is either a {@link KeyValue} or {@link Comment}.
     */
    record InlineNode(String kind, String label, LineToken body) implements LineToken {}

    /** {@code key: value}. */
    record KeyValue(String key, String value) implements LineToken {}
}
