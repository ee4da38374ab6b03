package com.astrepr.ast;

import java.util.List;

public record TryExpr(
    String position,
    Block tryBlock,
    List<CatchClause> catches,
    Block finallyBlock  // Can be null
) implements Expression {

    @Override
    public String kind() {
        return "TryExpr";
    }
}
