package com.exprformat.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A compound syntactic form: a head naming the form and its ordered children.
 *
 * <p>The head is kept as a string so that a parser can hand over forms this library
 * does not model. Such nodes render as a visible error sentinel instead of failing.
 *
 * @param head head spelling, see {@link NodeKind#head()}
 * @param children children in source order
 */
public record Node(String head, List<Expr> children) implements Expr {

    public Node {
        Objects.requireNonNull(head, "head must not be null");
        Objects.requireNonNull(children, "children must not be null");
        children = List.copyOf(children);
    }

    /**
     * Creates a node of a supported kind.
     *
     * @param kind node kind
     * @param children children in order
     * @return the node
     */
    public static Node of(NodeKind kind, Expr... children) {
        return new Node(kind.head(), List.of(children));
    }

    /**
     * Creates a node of a supported kind from a list of children.
     *
     * @param kind node kind
     * @param children children in order
     * @return the node
     */
    public static Node of(NodeKind kind, List<? extends Expr> children) {
        return new Node(kind.head(), List.copyOf(children));
    }

    /**
     * Creates a node with an arbitrary head.
     *
     * @param head head spelling
     * @param children children in order
     * @return the node
     */
    public static Node of(String head, Expr... children) {
        return new Node(head, List.of(children));
    }

    /**
     * Returns the kind of this node.
     *
     * @return the kind, or empty when the head is unsupported
     */
    public Optional<NodeKind> kind() {
        return NodeKind.fromHead(head);
    }

    /**
     * Tests whether this node is of the given kind.
     *
     * @param kind kind to test
     * @return true if the head matches
     */
    public boolean is(NodeKind kind) {
        return kind.head().equals(head);
    }

    public Expr child(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    /**
     * Returns the children from {@code fromIndex} to the end.
     *
     * @param fromIndex first index, may equal {@link #size()}
     * @return the tail of the children, empty when {@code fromIndex >= size()}
     */
    public List<Expr> childrenFrom(int fromIndex) {
        return fromIndex >= children.size() ? List.of() : children.subList(fromIndex, children.size());
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitNode(this, level);
    }
}
