package com.astrepr.ast;

public record ThrowExpr(
    String position,
    Expression value  // Can be null
) implements Expression {

    @Override
    public String kind() {
        return "ThrowExpr";
    }
}
