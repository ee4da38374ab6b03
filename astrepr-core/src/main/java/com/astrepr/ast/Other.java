package com.astrepr.ast;

import com.astrepr.tree.ReprNode;

/**
 * Catch-all for nodes without a canonical form: unknown kinds, and known kinds whose
 * children do not match the shape expected for them. Keeps the generic node so the
 * placeholder can still show what was there.
 */
public record Other(ReprNode source) implements Expression {

    @Override
    public String kind() {
        return source.kind();
    }

    @Override
    public String position() {
        return source.position().orElse(null);
    }
}
