package com.astrepr.ast;

public record MemberAccess(
    String position,
    Expression base,  // Can be null
    String field
) implements Expression {

    @Override
    public String kind() {
        return "MemberAccess";
    }
}
