package com.astrepr.ast;

public record PrimitiveType(
    String position,
    String name
) implements TypeNode {

    @Override
    public String kind() {
        return "PrimitiveType";
    }
}
