package com.exprformat.core.render;

import com.exprformat.core.model.Expr;

/**
 * A pure function from an expression tree and an indentation level to an output value.
 *
 * <p>Implementations are total: every tree renders, unsupported forms included.
 * They hold no mutable state and may be shared between threads.
 *
 * @param <T> output type
 */
public interface ExpressionRenderer<T> {

    /**
     * Renders a tree at the given indentation level.
     *
     * @param expr tree to render
     * @param level indentation level, not negative
     * @return the rendering
     * @throws IllegalArgumentException if {@code level} is negative
     */
    T render(Expr expr, int level);

    /**
     * Renders a tree at level 0.
     *
     * @param expr tree to render
     * @return the rendering
     */
    default T render(Expr expr) {
        return render(expr, 0);
    }
}
