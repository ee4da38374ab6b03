package com.astrepr.ast;

import java.util.List;

public record MatchCase(
    String position,
    CasePattern pattern,
    List<Node> body
) implements Node {

    @Override
    public String kind() {
        return "MatchCase";
    }
}
