package com.exprformat.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact rational literal {@code numerator//denominator}. The fraction is kept as
 * written, not reduced.
 *
 * @param numerator numerator
 * @param denominator denominator
 */
public record RationalAtom(BigInteger numerator, BigInteger denominator) implements Expr {

    public RationalAtom {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitRational(this, level);
    }
}
