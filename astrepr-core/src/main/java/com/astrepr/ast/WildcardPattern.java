package com.astrepr.ast;

public record WildcardPattern(
    String position,
    String name
) implements CasePattern {

    @Override
    public String kind() {
        return "WildcardPattern";
    }
}
