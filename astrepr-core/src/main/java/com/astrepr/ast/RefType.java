package com.astrepr.ast;

import java.util.List;

public record RefType(
    String position,
    String name,
    List<TypeNode> typeArguments
) implements TypeNode {

    @Override
    public String kind() {
        return "RefType";
    }
}
