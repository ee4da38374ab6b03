package com.astrepr.ast;

public record ReturnExpr(
    String position,
    Expression value  // Can be null
) implements Expression {

    @Override
    public String kind() {
        return "ReturnExpr";
    }
}
