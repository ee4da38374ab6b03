package com.astrepr.codegen;

/**
 * Desugared dumps contain compiler-generated names such as {@code $frameLambda} or
 * {@code tmp-1} that no standard lexer accepts.
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    /**
     * Replaces every {@code -} with {@code __} and every {@code $} with {@code dollar_}.
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.replace("-", "__").replace("$", "dollar_");
    }
}
