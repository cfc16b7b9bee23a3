package com.exprformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Tuple literal {@code (e1,e2,...)}.
 *
 * @param elements elements in order
 */
public record TupleLiteral(List<Expr> elements) implements Expr {

    public TupleLiteral {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitTuple(this, level);
    }
}
