package com.exprformat.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Mapping literal, an ordered sequence of {@link Pair} entries rendered one entry per line.
 *
 * @param entries entries in order
 */
public record MappingLiteral(List<Pair> entries) implements Expr {

    public MappingLiteral {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitMapping(this, level);
    }
}
