package com.astrepr.ast;

public record FuncParam(
    String position,
    String name,
    TypeNode type  // Can be null
) implements Node {

    @Override
    public String kind() {
        return "FuncParam";
    }
}
