package com.astrepr.ast;

public record TypePattern(
    String position,
    String binding,
    String typeName
) implements CasePattern {

    @Override
    public String kind() {
        return "TypePattern";
    }
}
