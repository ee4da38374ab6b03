package com.astrepr.ast;

public record VarDecl(
    String position,
    String name,
    TypeNode type,  // Can be null
    Node initializer  // Can be null
) implements Node {

    @Override
    public String kind() {
        return "VarDecl";
    }
}
