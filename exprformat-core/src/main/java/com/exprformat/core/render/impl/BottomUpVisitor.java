package com.exprformat.core.render.impl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.exprformat.core.model.Expr;
import com.exprformat.core.model.ExprVisitor;
import com.exprformat.core.model.ListLiteral;
import com.exprformat.core.model.MappingLiteral;
import com.exprformat.core.model.Node;
import com.exprformat.core.model.NodeKind;
import com.exprformat.core.model.Pair;
import com.exprformat.core.model.QuotedReference;
import com.exprformat.core.model.TupleLiteral;

/**
 * Visitor base that renders a tree bottom-up instead of by recursive descent, so the
 * depth of the tree does not bound the depth of the call stack.
 *
 * <p>{@link #run(Expr, int)} first walks the tree with an explicit work stack and
 * collects every (expression, level) pair the layout will ask for, children before
 * parents. It then visits the pairs in that order. When a visit method asks for a child
 * through {@link #at(Expr, int)} or {@link #inline(Expr)}, the child is already done
 * and is looked up; only a pair the walk did not predict falls back to a direct visit.
 * A result is dropped as soon as every form that uses it has been built.
 *
 * <p>One instance serves a single {@code run}; renderers create a fresh one per call.
 *
 * @param <R> rendering type
 */
abstract class BottomUpVisitor<R> implements ExprVisitor<R> {

    private final Map<Slot, R> done = new HashMap<>();
    private final Map<Slot, Integer> pendingUses = new HashMap<>();

    /**
     * Renders {@code root} at {@code level}.
     */
    final R run(Expr root, int level) {
        Slot rootSlot = new Slot(root, level);
        for (Step step : schedule(rootSlot)) {
            done.put(step.slot(), step.slot().expr().accept(this, step.slot().level()));
            for (Slot part : step.parts()) {
                if (pendingUses.merge(part, -1, Integer::sum) == 0) {
                    pendingUses.remove(part);
                    done.remove(part);
                }
            }
        }
        return done.get(rootSlot);
    }

    /**
     * Returns the rendering of {@code expr} at {@code level}.
     */
    protected final R at(Expr expr, int level) {
        R rendered = done.get(new Slot(expr, level));
        return rendered != null ? rendered : expr.accept(this, level);
    }

    /**
     * Returns the rendering of {@code expr} at level 0.
     */
    protected final R inline(Expr expr) {
        return at(expr, 0);
    }

    private List<Step> schedule(Slot root) {
        List<Step> order = new ArrayList<>();
        Set<Slot> seen = new HashSet<>();
        Deque<Step> work = new ArrayDeque<>();
        work.push(new Step(root, null));
        while (!work.isEmpty()) {
            Step step = work.pop();
            if (step.parts() != null) {
                order.add(step);
                continue;
            }
            if (!seen.add(step.slot())) {
                continue;
            }
            List<Slot> parts = parts(step.slot());
            for (Slot part : parts) {
                pendingUses.merge(part, 1, Integer::sum);
            }
            work.push(new Step(step.slot(), parts));
            for (Slot part : parts) {
                work.push(new Step(part, null));
            }
        }
        return order;
    }

    /**
     * Lists the sub-expressions a form is built from, each with the level it is
     * rendered at. Listing a part the layout ends up not using costs a wasted render;
     * missing one costs a recursive visit.
     */
    static List<Slot> parts(Slot slot) {
        Expr expr = slot.expr();
        int level = slot.level();
        List<Slot> parts = new ArrayList<>();
        if (expr instanceof TupleLiteral tuple) {
            addAll(parts, tuple.elements(), 0);
        } else if (expr instanceof ListLiteral list) {
            addAll(parts, list.elements(), 0);
        } else if (expr instanceof MappingLiteral mapping) {
            addAll(parts, mapping.entries(), level + 1);
        } else if (expr instanceof Pair pair) {
            parts.add(new Slot(pair.first(), 0));
            parts.add(new Slot(pair.second(), 0));
        } else if (expr instanceof QuotedReference quoted) {
            parts.add(new Slot(quoted.inner(), 0));
        } else if (expr instanceof Node node) {
            nodeParts(parts, node, level);
        }
        return parts;
    }

    private static void nodeParts(List<Slot> parts, Node node, int level) {
        NodeKind kind = PlainTextRenderer.renderableKind(node).orElse(null);
        if (kind == null) {
            addAll(parts, node.children(), 0);
            return;
        }
        switch (kind) {
            case MAPPING -> addAll(parts, node.children(), level + 1);
            case BLOCK -> addAll(parts, node.children(), node.size() == 1 ? level : level + 1);
            case CONDITIONAL, MODULE -> {
                parts.add(new Slot(node.child(0), 0));
                addAll(parts, node.childrenFrom(1), level + 1);
            }
            case LET -> {
                parts.add(new Slot(node.child(0), level + 1));
                addAll(parts, node.childrenFrom(1), 0);
            }
            case FUNCTION, MACRO -> {
                parts.add(new Slot(node.child(0), 0));
                addAll(parts, PlainTextRenderer.bodyStatements(node), level + 1);
            }
            case CALL -> {
                if (PlainTextRenderer.isMappingCall(node)) {
                    addAll(parts, node.childrenFrom(1), level + 1);
                } else {
                    parts.add(new Slot(node.child(0), level));
                    addAll(parts, node.childrenFrom(1), 0);
                }
            }
            case LAMBDA, ASSIGNMENT, MACRO_CALL -> {
                parts.add(new Slot(node.child(0), level));
                addAll(parts, node.childrenFrom(1), 0);
            }
            case TOP_LEVEL -> addAll(parts, node.children(), level);
            default -> addAll(parts, node.children(), 0);
        }
    }

    private static void addAll(List<Slot> parts, List<? extends Expr> exprs, int level) {
        for (Expr expr : exprs) {
            parts.add(new Slot(expr, level));
        }
    }

    /**
     * An expression at a level. Equality is identity of the expression: record equality
     * would walk the whole subtree.
     */
    record Slot(Expr expr, int level) {

        @Override
        public boolean equals(Object other) {
            return other instanceof Slot slot && slot.expr == expr && slot.level == level;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(expr) + level;
        }
    }

    /**
     * A scheduled slot. {@code parts} is null until the slot's parts have been pushed.
     */
    private record Step(Slot slot, List<Slot> parts) {
    }
}
