package com.astrepr.ast;

public record IfExpr(
    String position,
    Expression condition,  // Can be null
    Block thenBranch,
    Expression elseBranch  // Block, IfExpr for "else if", or null
) implements Expression {

    @Override
    public String kind() {
        return "IfExpr";
    }
}
