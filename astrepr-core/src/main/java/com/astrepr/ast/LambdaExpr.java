package com.astrepr.ast;

import java.util.List;

public record LambdaExpr(
    String position,
    List<String> parameters,
    Block body  // Null when the dump has no FuncBody
) implements Expression {

    @Override
    public String kind() {
        return "LambdaExpr";
    }
}
