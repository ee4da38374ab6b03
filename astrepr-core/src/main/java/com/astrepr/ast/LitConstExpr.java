package com.astrepr.ast;

public record LitConstExpr(
    String position,
    String subkind,  // "String", "Integer", "Bool", "Unit", ...
    String value  // Can be null
) implements Expression {

    public LiteralKind literalKind() {
        return LiteralKind.of(subkind);
    }

    @Override
    public String kind() {
        return "LitConstExpr";
    }
}
