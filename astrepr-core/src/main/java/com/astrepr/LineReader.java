package com.astrepr;

import java.util.List;

/**
 * Cursor over the fully buffered lines of an AST-repr dump. Each line is classified once,
 * up front.
 */
final class LineReader {

    private final List<LineToken> tokens;
    private int current = 0;

    LineReader(List<String> lines) {
        this.tokens = lines.stream().map(LineClassifier::classify).toList();
    }

    boolean isAtEnd() {
        return current >= tokens.size();
    }

    LineToken advance() {
        if (isAtEnd()) {
            return null;
        }
        return tokens.get(current++);
    }

    /**
     * 1-based number of the line that {@link #advance()} returned last.
     */
    int lineNumber() {
        return current;
    }
}
