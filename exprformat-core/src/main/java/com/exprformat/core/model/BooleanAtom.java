package com.exprformat.core.model;

/**
 * Boolean literal.
 *
 * @param value the literal value
 */
public record BooleanAtom(boolean value) implements Expr {

    public static final BooleanAtom TRUE = new BooleanAtom(true);
    public static final BooleanAtom FALSE = new BooleanAtom(false);

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitBoolean(this, level);
    }
}
