package com.exprformat.core.model;

import java.util.Objects;

/**
 * An identifier or operator name, identified by its spelling.
 *
 * @param name the spelling, e.g. {@code x}, {@code Int64} or {@code +}
 */
public record Symbol(String name) implements Expr {

    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("symbol name must not be empty");
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitSymbol(this, level);
    }
}
