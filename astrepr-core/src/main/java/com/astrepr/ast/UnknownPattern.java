package com.astrepr.ast;

public record UnknownPattern(
    String position
) implements CasePattern {

    @Override
    public String kind() {
        return "UnknownPattern";
    }
}
