package com.astrepr.codegen;

/**
 * Rendering settings for one {@link CodeGenerator}. Immutable, so generators with
 * different settings can run side by side.
 *
 * @param includePositionComments emit a {@code // position: ...} line before each declaration and statement
 * @param sanitizeIdentifiers rewrite {@code -} and {@code $} in identifiers so a standard lexer accepts them
 */
public record GeneratorOptions(boolean includePositionComments, boolean sanitizeIdentifiers) {

    public static final GeneratorOptions DEFAULTS = new GeneratorOptions(true, false);

    public GeneratorOptions withPositionComments(boolean include) {
        return new GeneratorOptions(include, sanitizeIdentifiers);
    }

    public GeneratorOptions withSanitizedIdentifiers(boolean sanitize) {
        return new GeneratorOptions(includePositionComments, sanitize);
    }
}
