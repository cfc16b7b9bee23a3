package com.exprformat.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed integer literal of any width, rendered in decimal.
 *
 * @param value the literal value
 */
public record SignedInteger(BigInteger value) implements Expr {

    public SignedInteger {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitSignedInteger(this, level);
    }
}
