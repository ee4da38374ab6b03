package com.astrepr.ast;

/**
 * Rendering category of a {@code LitConstExpr}, derived from its declared subkind.
 */
public enum LiteralKind {
    STRING,
    INTEGER,
    BOOL,
    UNIT,
    OTHER;

    public static LiteralKind of(String subkind) {
        if (subkind == null) {
            return OTHER;
        }
        if (subkind.contains("String") || subkind.contains("string")) {
            return STRING;
        }
        // "Integer", "Int64", "UInt8", ...
        if (subkind.contains("Int")) {
            return INTEGER;
        }
        if (subkind.contains("Bool")) {
            return BOOL;
        }
        if (subkind.contains("Unit")) {
            return UNIT;
        }
        return OTHER;
    }
}
