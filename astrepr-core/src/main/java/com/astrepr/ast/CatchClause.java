package com.astrepr.ast;

public record CatchClause(
    String position,
    String binding,  // Null together with exceptionType for a bare catch
    String exceptionType,
    Block body
) implements Node {
    public boolean hasPattern() {
        return binding != null && exceptionType != null;
    }

    @Override
    public String kind() {
        return "Catch";
    }
}
