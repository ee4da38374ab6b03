package com.astrepr.ast;

import java.util.List;

public record ClassDecl(
    String position,
    String name,
    List<TypeNode> inheritedTypes,
    List<Node> members
) implements Node {

    @Override
    public String kind() {
        return "ClassDecl";
    }
}
