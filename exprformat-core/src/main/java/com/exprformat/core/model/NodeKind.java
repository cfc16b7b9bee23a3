package com.exprformat.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of syntactic forms a {@link Node} can represent.
 *
 * <p>Each kind is identified by the head spelling an external parser uses for it.
 * The positional meaning of a node's children is fixed by its kind:
 * <ul>
 *   <li>{@link #CONDITIONAL}: condition, then-branch, optional else-branch</li>
 *   <li>{@link #LET}: body first, then the bindings</li>
 *   <li>{@link #FUNCTION}, {@link #MACRO}: signature, optional body</li>
 *   <li>{@link #MODULE}: name, then the top-level forms</li>
 *   <li>{@link #CALL}, {@link #MACRO_CALL}: callee, then the arguments</li>
 *   <li>{@link #MEMBER_ACCESS}: target, then the field (usually a quoted symbol)</li>
 * </ul>
 * Every other kind takes its operands in source order.
 */
public enum NodeKind {
    RATIONAL("//", 2, 2),
    PAIR("=>", 2, 2),
    TUPLE("tuple", 0, Arity.ANY),
    LIST("vect", 0, Arity.ANY),
    MAPPING("dict", 0, Arity.ANY),
    QUOTE("quote", 1, Arity.ANY),
    UNQUOTE("$", 1, 1),
    SPLAT("...", 1, 1),
    BLOCK("block", 0, Arity.ANY),
    CONDITIONAL("if", 2, 3),
    COMPARISON("comparison", 1, Arity.ANY),
    LET("let", 1, Arity.ANY),
    FUNCTION("function", 1, 2),
    MACRO("macro", 1, 2),
    LAMBDA("->", 2, 2),
    ASSIGNMENT("=", 2, 2),
    INDEXING("ref", 1, Arity.ANY),
    RANGE(":", 2, 3),
    MODULE("module", 1, Arity.ANY),
    IMPORT("import", 1, Arity.ANY),
    USING("using", 1, Arity.ANY),
    EXPORT("export", 1, Arity.ANY),
    MEMBER_ACCESS(".", 2, 2),
    TYPE_ANNOTATION("::", 1, 2),
    PARAMETERIZATION("curly", 1, Arity.ANY),
    AND("&&", 2, 2),
    OR("||", 2, 2),
    CALL("call", 1, Arity.ANY),
    MACRO_CALL("macrocall", 1, Arity.ANY),
    TOP_LEVEL("toplevel", 0, Arity.ANY);

    private static final Map<String, NodeKind> BY_HEAD = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(NodeKind::head, Function.identity()));

    private final String head;
    private final int minChildren;
    private final int maxChildren;

    NodeKind(String head, int minChildren, int maxChildren) {
        this.head = head;
        this.minChildren = minChildren;
        this.maxChildren = maxChildren;
    }

    /**
     * Returns the head spelling identifying this kind.
     *
     * @return head spelling
     */
    public String head() {
        return head;
    }

    /**
     * Tests whether a node of this kind may have {@code count} children.
     *
     * @param count number of children
     * @return true if the count is within this kind's arity
     */
    public boolean acceptsArity(int count) {
        return count >= minChildren && count <= maxChildren;
    }

    /**
     * Looks up the kind for a head spelling.
     *
     * @param head head spelling
     * @return the kind, or empty when the head is not a supported form
     */
    public static Optional<NodeKind> fromHead(String head) {
        return Optional.ofNullable(BY_HEAD.get(head));
    }

    private static final class Arity {
        static final int ANY = Integer.MAX_VALUE;
    }
}
