package com.exprformat.core.model;

/**
 * The absent value, spelled {@code nothing}.
 */
public record NilAtom() implements Expr {

    static final NilAtom INSTANCE = new NilAtom();

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitNil(this, level);
    }
}
