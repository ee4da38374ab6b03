package com.astrepr.ast;

import java.util.List;

public record FuncDecl(
    String position,
    String name,
    List<FuncParam> parameters,
    TypeNode returnType,  // Can be null
    Block body  // Can be null
) implements Node {
    public boolean isInit() {
        return "init".equals(name);
    }

    @Override
    public String kind() {
        return "FuncDecl";
    }
}
