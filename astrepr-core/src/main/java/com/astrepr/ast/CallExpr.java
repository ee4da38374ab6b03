package com.astrepr.ast;

import java.util.List;

public record CallExpr(
    String position,
    Expression callee,
    List<Expression> arguments
) implements Expression {

    @Override
    public String kind() {
        return "CallExpr";
    }
}
