package com.astrepr.ast;

import java.util.List;

public record Block(
    String position,
    List<Node> statements
) implements Expression {
    public static Block empty() {
        return new Block(null, List.of());
    }

    @Override
    public String kind() {
        return "Block";
    }
}
