package com.exprformat.core.model;

import java.util.Objects;

/**
 * String literal. The content is kept verbatim; renderers do not escape it.
 *
 * @param value the string content
 */
public record StringAtom(String value) implements Expr {

    public StringAtom {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitString(this, level);
    }
}
