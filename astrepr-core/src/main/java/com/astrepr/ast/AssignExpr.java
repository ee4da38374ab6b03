package com.astrepr.ast;

public record AssignExpr(
    String position,
    Expression left,  // Null when only the assigned value is present
    Expression right
) implements Expression {

    @Override
    public String kind() {
        return "AssignExpr";
    }
}
