package com.astrepr.ast;

public record MainDecl(
    String position,
    Block body
) implements Node {

    @Override
    public String kind() {
        return "MainDecl";
    }
}
