package com.astrepr.ast;

import java.util.List;

public record SourceFile(
    String position,
    String name,
    List<Node> items
) implements Node {

    @Override
    public String kind() {
        return "File";
    }
}
