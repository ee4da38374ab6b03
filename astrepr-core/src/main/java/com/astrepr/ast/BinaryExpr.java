package com.astrepr.ast;

public record BinaryExpr(
    String position,
    String operator,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String kind() {
        return "BinaryExpr";
    }
}
