package com.exprformat.core.model;

/**
 * Floating point literal.
 *
 * @param value the literal value
 */
public record FloatingPoint(double value) implements Expr {

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitFloatingPoint(this, level);
    }
}
