package com.astrepr.ast;

public record PackageSpec(
    String position,
    String name
) implements Node {

    @Override
    public String kind() {
        return "PackageSpec";
    }
}
