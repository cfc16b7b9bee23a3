package com.exprformat.core.model;

import java.util.Objects;

/**
 * A quoted name or form: refers to {@code inner} instead of evaluating it.
 *
 * @param inner the quoted symbol or form
 */
public record QuotedReference(Expr inner) implements Expr {

    public QuotedReference {
        Objects.requireNonNull(inner, "inner must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitQuotedReference(this, level);
    }
}
