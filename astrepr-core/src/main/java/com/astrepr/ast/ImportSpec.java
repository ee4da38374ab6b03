package com.astrepr.ast;

public record ImportSpec(
    String position,
    String prefixPaths,
    String item  // "*" for a wildcard import
) implements Node {
    public static final String WILDCARD = "*";

    public boolean isWildcard() {
        return WILDCARD.equals(item);
    }

    @Override
    public String kind() {
        return "ImportSpec";
    }
}
