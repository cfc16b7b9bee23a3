package com.exprformat.core.model;

import java.util.Objects;

/**
 * Key/value pair {@code first => second}.
 *
 * @param first key
 * @param second value
 */
public record Pair(Expr first, Expr second) implements Expr {

    public Pair {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitPair(this, level);
    }
}
