package com.exprformat.core.render.impl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exprformat.core.model.BooleanAtom;
import com.exprformat.core.model.CharacterAtom;
import com.exprformat.core.model.Expr;
import com.exprformat.core.model.FloatingPoint;
import com.exprformat.core.model.ListLiteral;
import com.exprformat.core.model.MappingLiteral;
import com.exprformat.core.model.NilAtom;
import com.exprformat.core.model.Node;
import com.exprformat.core.model.NodeKind;
import com.exprformat.core.model.Pair;
import com.exprformat.core.model.QuotedReference;
import com.exprformat.core.model.RationalAtom;
import com.exprformat.core.model.SignedInteger;
import com.exprformat.core.model.StringAtom;
import com.exprformat.core.model.Symbol;
import com.exprformat.core.model.TupleLiteral;
import com.exprformat.core.model.UnsignedInteger;
import com.exprformat.core.render.ExpressionRenderer;
import com.exprformat.core.render.Literals;
import com.exprformat.core.util.Indentation;

/**
 * Renders an expression tree as canonical, indented source text.
 *
 * <p>Layout rules:
 * <ul>
 *   <li>A form rendered at level {@code n} starts with {@code n} indentation units.</li>
 *   <li>Block bodies ({@code if}, {@code let}, {@code function}, {@code macro},
 *       {@code module}, multi-statement {@code begin}, mapping entries) are rendered at
 *       {@code n + 1}; their closing {@code end} goes back to {@code n}.</li>
 *   <li>Inline operands (tuple and list elements, call arguments, right-hand sides)
 *       are rendered at level 0 and stay on one line.</li>
 *   <li>Forms the renderer does not know become
 *       {@code ERROR: could not print <form> :ERROR} at their position; the rest of
 *       the tree still renders.</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Expr expr = Node.of(NodeKind.CONDITIONAL, Expr.symbol("cond"), Expr.symbol("A"), Expr.symbol("B"));
 * new PlainTextRenderer().render(expr);
 * // if cond
 * //   A
 * // else
 * //   B
 * // end
 * }</pre>
 *
 * @see MarkupRenderer
 */
public class PlainTextRenderer implements ExpressionRenderer<String> {

    private static final Logger log = LoggerFactory.getLogger(PlainTextRenderer.class);

    static final String SENTINEL_PREFIX = "ERROR: could not print ";
    static final String SENTINEL_SUFFIX = " :ERROR";

    private static final String NEWLINE = "\n";
    private static final String BLANK_LINE = "\n\n";
    private static final String END = "end";
    private static final String DICT = "Dict";

    private final Indentation indentation;

    /**
     * Creates a renderer with the default indentation width.
     */
    public PlainTextRenderer() {
        this(Indentation.DEFAULT);
    }

    /**
     * Creates a renderer.
     *
     * @param indentation indentation unit
     */
    public PlainTextRenderer(Indentation indentation) {
        this.indentation = Objects.requireNonNull(indentation, "indentation must not be null");
    }

    public Indentation indentation() {
        return indentation;
    }

    @Override
    public String render(Expr expr, int level) {
        Objects.requireNonNull(expr, "expr must not be null");
        Indentation.requireLevel(level);
        return new TextVisitor().run(expr, level);
    }

    /**
     * Returns the error sentinel for a node that cannot be rendered,
     * {@code ERROR: could not print Expr(:head, child1, child2) :ERROR}.
     *
     * @param node the node
     * @param inline inline rendering of a child
     * @return sentinel text
     */
    static String sentinel(Node node, Function<Expr, String> inline) {
        StringBuilder sb = new StringBuilder(SENTINEL_PREFIX).append("Expr(:").append(node.head());
        for (Expr child : node.children()) {
            sb.append(", ").append(inline.apply(child));
        }
        return sb.append(')').append(SENTINEL_SUFFIX).toString();
    }

    /**
     * Resolves the kind a node is rendered as: its kind, if supported and the node
     * has a valid number of children for it.
     *
     * @param node the node
     * @return the kind, or empty if the node renders as the sentinel
     */
    static Optional<NodeKind> renderableKind(Node node) {
        return node.kind().filter(kind -> kind.acceptsArity(node.size()));
    }

    /**
     * Tests whether a call node is the mapping constructor {@code Dict(k => v, ...)}.
     */
    static boolean isMappingCall(Node node) {
        return node.is(NodeKind.CALL) && node.child(0) instanceof Symbol callee && DICT.equals(callee.name());
    }

    /**
     * Returns the statements of a function or macro body.
     */
    static List<Expr> bodyStatements(Node definition) {
        if (definition.size() < 2) {
            return List.of();
        }
        Expr body = definition.child(1);
        if (body instanceof Node block && block.is(NodeKind.BLOCK)) {
            return block.children();
        }
        return List.of(body);
    }

    /**
     * Returns the field name of a member access when it is a plain or quoted symbol.
     */
    static Optional<String> fieldName(Expr field) {
        if (field instanceof Symbol symbol) {
            return Optional.of(symbol.name());
        }
        if (field instanceof QuotedReference quoted && quoted.inner() instanceof Symbol symbol) {
            return Optional.of(symbol.name());
        }
        return Optional.empty();
    }

    /**
     * Tests whether an operand of {@code &&} / {@code ||} needs parentheses: it does
     * when it is itself the other logical operator.
     */
    static boolean needsGrouping(NodeKind parent, Expr operand) {
        NodeKind other = parent == NodeKind.AND ? NodeKind.OR : NodeKind.AND;
        return operand instanceof Node node && node.is(other);
    }

    /**
     * Visits one tree per {@link #render(Expr, int)} call.
     */
    private final class TextVisitor extends BottomUpVisitor<String> {

        private String joinInline(List<? extends Expr> exprs, String separator) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < exprs.size(); i++) {
                if (i > 0) {
                    sb.append(separator);
                }
                sb.append(inline(exprs.get(i)));
            }
            return sb.toString();
        }

        private String mapping(List<? extends Expr> entries, int level) {
            StringBuilder sb = new StringBuilder(indentation.prefix(level)).append(DICT).append('(').append(NEWLINE);
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    sb.append(',').append(NEWLINE);
                }
                sb.append(at(entries.get(i), level + 1));
            }
            return sb.append(')').toString();
        }

        @Override
        public String visitNil(NilAtom nil, int level) {
            return indentation.line(level, Literals.NIL);
        }

        @Override
        public String visitBoolean(BooleanAtom bool, int level) {
            return indentation.line(level, Literals.of(bool));
        }

        @Override
        public String visitSignedInteger(SignedInteger integer, int level) {
            return indentation.line(level, Literals.of(integer));
        }

        @Override
        public String visitUnsignedInteger(UnsignedInteger integer, int level) {
            return indentation.line(level, Literals.of(integer));
        }

        @Override
        public String visitFloatingPoint(FloatingPoint number, int level) {
            return indentation.line(level, Literals.of(number));
        }

        @Override
        public String visitRational(RationalAtom rational, int level) {
            return indentation.line(level, Literals.of(rational));
        }

        @Override
        public String visitCharacter(CharacterAtom character, int level) {
            return indentation.line(level, Literals.of(character));
        }

        @Override
        public String visitString(StringAtom string, int level) {
            return indentation.line(level, Literals.of(string));
        }

        @Override
        public String visitSymbol(Symbol symbol, int level) {
            return indentation.line(level, symbol.name());
        }

        @Override
        public String visitQuotedReference(QuotedReference quoted, int level) {
            if (quoted.inner() instanceof Symbol symbol) {
                return indentation.line(level, ":" + symbol.name());
            }
            return indentation.line(level, ":(" + inline(quoted.inner()) + ")");
        }

        @Override
        public String visitTuple(TupleLiteral tuple, int level) {
            return indentation.line(level, "(" + joinInline(tuple.elements(), ",") + ")");
        }

        @Override
        public String visitList(ListLiteral list, int level) {
            return indentation.line(level, "[" + joinInline(list.elements(), ",") + "]");
        }

        @Override
        public String visitMapping(MappingLiteral mapping, int level) {
            return mapping(mapping.entries(), level);
        }

        @Override
        public String visitPair(Pair pair, int level) {
            return indentation.line(level, inline(pair.first()) + " => " + inline(pair.second()));
        }

        @Override
        public String visitNode(Node node, int level) {
            Optional<NodeKind> kind = renderableKind(node);
            if (kind.isEmpty()) {
                log.debug("No plain-text form for node '{}' with {} children", node.head(), node.size());
                return indentation.line(level, sentinel(node, this::inline));
            }
            return renderNode(kind.get(), node, level);
        }

        private String renderNode(NodeKind kind, Node node, int level) {
            return switch (kind) {
                case RATIONAL -> indentation.line(level, inline(node.child(0)) + "//" + inline(node.child(1)));
                case PAIR -> indentation.line(level, inline(node.child(0)) + " => " + inline(node.child(1)));
                case TUPLE -> indentation.line(level, "(" + joinInline(node.children(), ",") + ")");
                case LIST -> indentation.line(level, "[" + joinInline(node.children(), ",") + "]");
                case MAPPING -> mapping(node.children(), level);
                case QUOTE -> quote(node, level);
                case UNQUOTE -> unquote(node, level);
                case SPLAT -> indentation.line(level, inline(node.child(0)) + "...");
                case BLOCK -> block(node, level);
                case CONDITIONAL -> conditional(node, level);
                case COMPARISON -> indentation.line(level, "(" + joinInline(node.children(), " ") + ")");
                case LET -> let(node, level);
                case FUNCTION, MACRO -> definition(kind, node, level);
                case LAMBDA -> at(node.child(0), level) + " -> " + inline(node.child(1));
                case ASSIGNMENT -> at(node.child(0), level) + " = " + inline(node.child(1));
                case INDEXING -> indentation.line(level,
                    inline(node.child(0)) + "[" + joinInline(node.childrenFrom(1), ",") + "]");
                case RANGE -> indentation.line(level, joinInline(node.children(), ":"));
                case MODULE -> module(node, level);
                case IMPORT, USING -> indentation.line(level, kind.head() + " " + joinInline(node.children(), "."));
                case EXPORT -> indentation.line(level, "export " + joinInline(node.children(), ","));
                case MEMBER_ACCESS -> indentation.line(level, inline(node.child(0)) + "."
                    + fieldName(node.child(1)).orElseGet(() -> inline(node.child(1))));
                case TYPE_ANNOTATION -> typeAnnotation(node, level);
                case PARAMETERIZATION -> indentation.line(level,
                    inline(node.child(0)) + "{" + joinInline(node.childrenFrom(1), ",") + "}");
                case AND, OR -> indentation.line(level, operand(kind, node.child(0))
                    + " " + kind.head() + " " + operand(kind, node.child(1)));
                case CALL -> isMappingCall(node) ? mapping(node.childrenFrom(1), level) : call(node, level);
                case MACRO_CALL -> call(node, level);
                case TOP_LEVEL -> topLevel(node, level);
            };
        }

        private String quote(Node node, int level) {
            if (node.size() == 1 && node.child(0) instanceof Symbol symbol) {
                return indentation.line(level, ":" + symbol.name());
            }
            return indentation.line(level, ":(" + joinInline(node.children(), NEWLINE) + ")");
        }

        private String unquote(Node node, int level) {
            if (node.child(0) instanceof Symbol symbol) {
                return indentation.line(level, "$" + symbol.name());
            }
            return indentation.line(level, "$(" + inline(node.child(0)) + ")");
        }

        private String block(Node node, int level) {
            if (node.size() == 1) {
                return at(node.child(0), level);
            }
            StringBuilder sb = new StringBuilder(indentation.line(level, "begin")).append(NEWLINE);
            for (Expr statement : node.children()) {
                sb.append(at(statement, level + 1)).append(NEWLINE);
            }
            return sb.append(indentation.line(level, END)).toString();
        }

        private String conditional(Node node, int level) {
            StringBuilder sb = new StringBuilder(indentation.line(level, "if "))
                .append(inline(node.child(0))).append(NEWLINE)
                .append(at(node.child(1), level + 1)).append(NEWLINE);
            if (node.size() > 2) {
                sb.append(indentation.line(level, "else")).append(NEWLINE)
                    .append(at(node.child(2), level + 1)).append(NEWLINE);
            }
            return sb.append(indentation.line(level, END)).toString();
        }

        private String let(Node node, int level) {
            StringBuilder sb = new StringBuilder(indentation.line(level, "let"));
            List<Expr> bindings = node.childrenFrom(1);
            if (!bindings.isEmpty()) {
                sb.append(' ').append(joinInline(bindings, ", "));
            }
            return sb.append(NEWLINE)
                .append(at(node.child(0), level + 1)).append(NEWLINE)
                .append(indentation.line(level, END))
                .toString();
        }

        private String definition(NodeKind kind, Node node, int level) {
            StringBuilder sb = new StringBuilder(indentation.line(level, kind.head()))
                .append(' ').append(inline(node.child(0))).append(NEWLINE);
            for (Expr statement : bodyStatements(node)) {
                sb.append(at(statement, level + 1)).append(NEWLINE);
            }
            return sb.append(indentation.line(level, END)).toString();
        }

        private String module(Node node, int level) {
            StringBuilder sb = new StringBuilder(indentation.line(level, "module "))
                .append(inline(node.child(0))).append(NEWLINE);
            List<Expr> forms = node.childrenFrom(1);
            for (int i = 0; i < forms.size(); i++) {
                if (i > 0) {
                    sb.append(BLANK_LINE);
                }
                sb.append(at(forms.get(i), level + 1));
            }
            if (!forms.isEmpty()) {
                sb.append(NEWLINE);
            }
            return sb.append(indentation.line(level, END)).toString();
        }

        private String typeAnnotation(Node node, int level) {
            if (node.size() == 1) {
                return indentation.line(level, "::" + inline(node.child(0)));
            }
            return indentation.line(level, inline(node.child(0)) + "::" + inline(node.child(1)));
        }

        private String operand(NodeKind parent, Expr operand) {
            return needsGrouping(parent, operand) ? "(" + inline(operand) + ")" : inline(operand);
        }

        private String call(Node node, int level) {
            return at(node.child(0), level) + "(" + joinInline(node.childrenFrom(1), ", ") + ")";
        }

        private String topLevel(Node node, int level) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) {
                    sb.append(NEWLINE);
                }
                sb.append(at(node.child(i), level));
            }
            return sb.toString();
        }
    }
}
