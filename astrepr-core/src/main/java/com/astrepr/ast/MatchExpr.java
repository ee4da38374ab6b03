package com.astrepr.ast;

import java.util.List;

public record MatchExpr(
    String position,
    Expression selector,  // Can be null
    List<MatchCase> cases
) implements Expression {

    @Override
    public String kind() {
        return "MatchExpr";
    }
}
