package com.astrepr.ast;

public record RefExpr(
    String position,
    String name
) implements Expression {

    @Override
    public String kind() {
        return "RefExpr";
    }
}
