package com.exprformat.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unsigned integer literal, rendered as {@code 0x} followed by lowercase hex digits.
 *
 * @param value the literal value, never negative
 */
public record UnsignedInteger(BigInteger value) implements Expr {

    public UnsignedInteger {
        Objects.requireNonNull(value, "value must not be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("unsigned value must not be negative: " + value);
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitUnsignedInteger(this, level);
    }
}
