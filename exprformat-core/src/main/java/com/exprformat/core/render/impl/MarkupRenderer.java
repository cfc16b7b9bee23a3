package com.exprformat.core.render.impl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exprformat.core.markup.Document;
import com.exprformat.core.markup.SymbolClassifier;
import com.exprformat.core.markup.Tag;
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
 * Renders an expression tree as a tagged {@link Document} for syntax highlighting.
 *
 * <p>The layout is exactly the one {@link PlainTextRenderer} produces: the visible
 * text of the document equals the plain-text rendering character for character.
 * What this renderer adds is structure:
 * <ul>
 *   <li>every node is one unit tagged with {@link Tag#forKind(NodeKind)};</li>
 *   <li>literals carry their constant tag, symbols the tag picked by
 *       {@link SymbolClassifier};</li>
 *   <li>brackets, commas, operators and reserved words are tagged separately;</li>
 *   <li>newlines and indentation stay untagged text, and the indentation of a form
 *       sits in front of its unit rather than inside it.</li>
 * </ul>
 *
 * <p>Operands of {@code &&} and {@code ||} are wrapped in parentheses when they are
 * themselves the other operator, so {@code a && (b || c)} keeps its grouping.
 *
 * @see com.exprformat.core.markup.MarkupFlattener
 */
public class MarkupRenderer implements ExpressionRenderer<Document> {

    private static final Logger log = LoggerFactory.getLogger(MarkupRenderer.class);

    private static final String NEWLINE = "\n";

    private final Indentation indentation;

    /**
     * Creates a renderer with the default indentation width.
     */
    public MarkupRenderer() {
        this(Indentation.DEFAULT);
    }

    /**
     * Creates a renderer.
     *
     * @param indentation indentation unit
     */
    public MarkupRenderer(Indentation indentation) {
        this.indentation = Objects.requireNonNull(indentation, "indentation must not be null");
    }

    public Indentation indentation() {
        return indentation;
    }

    @Override
    public Document render(Expr expr, int level) {
        Objects.requireNonNull(expr, "expr must not be null");
        Indentation.requireLevel(level);
        return new MarkupVisitor().run(expr, level);
    }

    /**
     * Puts the indentation for {@code level} in front of a unit.
     */
    private Document indented(int level, Document unit) {
        String prefix = indentation.raw(level, 0);
        return prefix.isEmpty() ? unit : Document.run(Document.text(prefix), unit);
    }

    private static Document paren(String bracket) {
        return Document.tagged(Tag.PAREN, bracket);
    }

    private static Document comma() {
        return Document.tagged(Tag.COMMA, ",");
    }

    private static Document reserved(String word) {
        return Document.tagged(Tag.RESERVED, word);
    }

    private static Document operator(String spelling) {
        return Document.tagged(Tag.OP_MISC, spelling);
    }

    private static Document symbol(String name) {
        return Document.tagged(SymbolClassifier.classify(name), name);
    }

    private final class MarkupVisitor extends BottomUpVisitor<Document> {

        /**
         * Adds the inline renderings of {@code exprs}, with {@code separators} between them.
         */
        private void interpose(Document.Builder builder, List<? extends Expr> exprs, Document... separators) {
            for (int i = 0; i < exprs.size(); i++) {
                if (i > 0) {
                    for (Document separator : separators) {
                        builder.add(separator);
                    }
                }
                builder.add(inline(exprs.get(i)));
            }
        }

        private Document sequence(Tag tag, String open, List<? extends Expr> elements, String close, int level) {
            Document.Builder builder = new Document.Builder().add(paren(open));
            interpose(builder, elements, comma());
            builder.add(paren(close));
            return indented(level, builder.tagged(tag));
        }

        private Document mapping(List<? extends Expr> entries, int level) {
            Document.Builder builder = new Document.Builder()
                .add(symbol("Dict"))
                .add(paren("("))
                .add(NEWLINE);
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    builder.add(comma()).add(NEWLINE);
                }
                builder.add(at(entries.get(i), level + 1));
            }
            builder.add(paren(")"));
            return indented(level, builder.tagged(Tag.DICT));
        }

        private Document pair(Tag tag, Expr first, Expr second, int level) {
            return indented(level, Document.tagged(tag,
                inline(first), Document.text(" "), operator("=>"), Document.text(" "), inline(second)));
        }

        @Override
        public Document visitNil(NilAtom nil, int level) {
            return indented(level, Document.tagged(Tag.NIL, Literals.NIL));
        }

        @Override
        public Document visitBoolean(BooleanAtom bool, int level) {
            return indented(level, Document.tagged(Tag.BOOL, Literals.of(bool)));
        }

        @Override
        public Document visitSignedInteger(SignedInteger integer, int level) {
            return indented(level, Document.tagged(Tag.NUMBER, Literals.of(integer)));
        }

        @Override
        public Document visitUnsignedInteger(UnsignedInteger integer, int level) {
            return indented(level, Document.tagged(Tag.HEX_NUMBER, Literals.of(integer)));
        }

        @Override
        public Document visitFloatingPoint(FloatingPoint number, int level) {
            return indented(level, Document.tagged(Tag.DECIMAL_NUMBER, Literals.of(number)));
        }

        @Override
        public Document visitRational(RationalAtom rational, int level) {
            return indented(level, Document.tagged(Tag.RATIONAL, Literals.of(rational)));
        }

        @Override
        public Document visitCharacter(CharacterAtom character, int level) {
            return indented(level, Document.tagged(Tag.CHAR, Literals.of(character)));
        }

        @Override
        public Document visitString(StringAtom string, int level) {
            return indented(level, Document.tagged(Tag.STRING, Literals.of(string)));
        }

        @Override
        public Document visitSymbol(Symbol symbol, int level) {
            return indented(level, symbol(symbol.name()));
        }

        @Override
        public Document visitQuotedReference(QuotedReference quoted, int level) {
            if (quoted.inner() instanceof Symbol symbol) {
                return indented(level, Document.tagged(Tag.KEYWORD, ":" + symbol.name()));
            }
            return indented(level, Document.tagged(Tag.QUOTED,
                Document.text(":"), paren("("), inline(quoted.inner()), paren(")")));
        }

        @Override
        public Document visitTuple(TupleLiteral tuple, int level) {
            return sequence(Tag.TUPLE, "(", tuple.elements(), ")", level);
        }

        @Override
        public Document visitList(ListLiteral list, int level) {
            return sequence(Tag.VECT, "[", list.elements(), "]", level);
        }

        @Override
        public Document visitMapping(MappingLiteral mapping, int level) {
            return mapping(mapping.entries(), level);
        }

        @Override
        public Document visitPair(Pair pair, int level) {
            return pair(Tag.PAIR, pair.first(), pair.second(), level);
        }

        @Override
        public Document visitNode(Node node, int level) {
            Optional<NodeKind> kind = PlainTextRenderer.renderableKind(node);
            if (kind.isEmpty()) {
                log.debug("No markup form for node '{}' with {} children", node.head(), node.size());
                return indented(level, Document.tagged(Tag.ERROR,
                    PlainTextRenderer.sentinel(node, child -> inline(child).text())));
            }
            return renderNode(kind.get(), node, level);
        }

        private Document renderNode(NodeKind kind, Node node, int level) {
            Tag tag = Tag.forKind(kind);
            return switch (kind) {
                case RATIONAL -> indented(level, Document.tagged(tag,
                    inline(node.child(0)), symbol("//"), inline(node.child(1))));
                case PAIR -> pair(tag, node.child(0), node.child(1), level);
                case TUPLE -> sequence(tag, "(", node.children(), ")", level);
                case LIST -> sequence(tag, "[", node.children(), "]", level);
                case MAPPING -> mapping(node.children(), level);
                case QUOTE -> quote(tag, node, level);
                case UNQUOTE -> unquote(tag, node, level);
                case SPLAT -> indented(level, Document.tagged(tag, inline(node.child(0)), operator("...")));
                case BLOCK -> block(tag, node, level);
                case CONDITIONAL -> conditional(tag, node, level);
                case COMPARISON -> comparison(tag, node, level);
                case LET -> let(tag, node, level);
                case FUNCTION, MACRO -> definition(tag, kind, node, level);
                case LAMBDA -> Document.tagged(tag, at(node.child(0), level),
                    Document.text(" "), operator("->"), Document.text(" "), inline(node.child(1)));
                case ASSIGNMENT -> Document.tagged(tag, at(node.child(0), level),
                    Document.text(" "), operator("="), Document.text(" "), inline(node.child(1)));
                case INDEXING -> bracketed(tag, node, "[", "]", level);
                case RANGE -> range(tag, node, level);
                case MODULE -> module(tag, node, level);
                case IMPORT, USING -> path(tag, kind, node, level);
                case EXPORT -> export(tag, node, level);
                case MEMBER_ACCESS -> memberAccess(tag, node, level);
                case TYPE_ANNOTATION -> typeAnnotation(tag, node, level);
                case PARAMETERIZATION -> bracketed(tag, node, "{", "}", level);
                case AND, OR -> logical(tag, kind, node, level);
                case CALL -> PlainTextRenderer.isMappingCall(node)
                    ? mapping(node.childrenFrom(1), level)
                    : call(tag, node, level);
                case MACRO_CALL -> call(tag, node, level);
                case TOP_LEVEL -> topLevel(tag, node, level);
            };
        }

        private Document quote(Tag tag, Node node, int level) {
            if (node.size() == 1 && node.child(0) instanceof Symbol symbol) {
                return indented(level, Document.tagged(tag, Document.tagged(Tag.KEYWORD, ":" + symbol.name())));
            }
            Document.Builder builder = new Document.Builder().add(":").add(paren("("));
            interpose(builder, node.children(), Document.text(NEWLINE));
            builder.add(paren(")"));
            return indented(level, builder.tagged(tag));
        }

        private Document unquote(Tag tag, Node node, int level) {
            Expr operand = node.child(0);
            if (operand instanceof Symbol symbol) {
                return indented(level, Document.tagged(tag, Document.text("$"), symbol(symbol.name())));
            }
            return indented(level, Document.tagged(tag,
                Document.text("$"), paren("("), inline(operand), paren(")")));
        }

        private Document block(Tag tag, Node node, int level) {
            if (node.size() == 1) {
                return Document.tagged(tag, at(node.child(0), level));
            }
            Document.Builder builder = new Document.Builder().add(reserved("begin")).add(NEWLINE);
            for (Expr statement : node.children()) {
                builder.add(at(statement, level + 1)).add(NEWLINE);
            }
            builder.add(indentation.raw(level, 0)).add(reserved("end"));
            return indented(level, builder.tagged(tag));
        }

        private Document conditional(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder()
                .add(reserved("if")).add(" ")
                .add(inline(node.child(0))).add(NEWLINE)
                .add(at(node.child(1), level + 1)).add(NEWLINE);
            if (node.size() > 2) {
                builder.add(indentation.raw(level, 0)).add(reserved("else")).add(NEWLINE)
                    .add(at(node.child(2), level + 1)).add(NEWLINE);
            }
            builder.add(indentation.raw(level, 0)).add(reserved("end"));
            return indented(level, builder.tagged(tag));
        }

        private Document comparison(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder().add(paren("("));
            interpose(builder, node.children(), Document.text(" "));
            builder.add(paren(")"));
            return indented(level, builder.tagged(tag));
        }

        private Document let(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder().add(reserved("let"));
            List<Expr> bindings = node.childrenFrom(1);
            if (!bindings.isEmpty()) {
                builder.add(" ");
                interpose(builder, bindings, comma(), Document.text(" "));
            }
            builder.add(NEWLINE)
                .add(at(node.child(0), level + 1)).add(NEWLINE)
                .add(indentation.raw(level, 0)).add(reserved("end"));
            return indented(level, builder.tagged(tag));
        }

        private Document definition(Tag tag, NodeKind kind, Node node, int level) {
            Document.Builder builder = new Document.Builder()
                .add(reserved(kind.head())).add(" ")
                .add(inline(node.child(0))).add(NEWLINE);
            for (Expr statement : PlainTextRenderer.bodyStatements(node)) {
                builder.add(at(statement, level + 1)).add(NEWLINE);
            }
            builder.add(indentation.raw(level, 0)).add(reserved("end"));
            return indented(level, builder.tagged(tag));
        }

        private Document bracketed(Tag tag, Node node, String open, String close, int level) {
            Document.Builder builder = new Document.Builder().add(inline(node.child(0))).add(paren(open));
            interpose(builder, node.childrenFrom(1), comma());
            builder.add(paren(close));
            return indented(level, builder.tagged(tag));
        }

        private Document range(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder();
            interpose(builder, node.children(), operator(":"));
            return indented(level, builder.tagged(tag));
        }

        private Document module(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder()
                .add(reserved("module")).add(" ")
                .add(inline(node.child(0))).add(NEWLINE);
            List<Expr> forms = node.childrenFrom(1);
            for (int i = 0; i < forms.size(); i++) {
                if (i > 0) {
                    builder.add(NEWLINE + NEWLINE);
                }
                builder.add(at(forms.get(i), level + 1));
            }
            if (!forms.isEmpty()) {
                builder.add(NEWLINE);
            }
            builder.add(indentation.raw(level, 0)).add(reserved("end"));
            return indented(level, builder.tagged(tag));
        }

        private Document path(Tag tag, NodeKind kind, Node node, int level) {
            Document.Builder builder = new Document.Builder().add(reserved(kind.head())).add(" ");
            interpose(builder, node.children(), Document.tagged(Tag.OP_DOT, "."));
            return indented(level, builder.tagged(tag));
        }

        private Document export(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder().add(reserved("export")).add(" ");
            interpose(builder, node.children(), comma());
            return indented(level, builder.tagged(tag));
        }

        private Document memberAccess(Tag tag, Node node, int level) {
            Expr field = node.child(1);
            Document fieldDoc = PlainTextRenderer.fieldName(field)
                .map(MarkupRenderer::symbol)
                .orElseGet(() -> inline(field));
            return indented(level, Document.tagged(tag,
                inline(node.child(0)), Document.tagged(Tag.OP_DOT, "."), fieldDoc));
        }

        private Document typeAnnotation(Tag tag, Node node, int level) {
            if (node.size() == 1) {
                return indented(level, Document.tagged(tag, operator("::"), inline(node.child(0))));
            }
            return indented(level, Document.tagged(tag,
                inline(node.child(0)), operator("::"), inline(node.child(1))));
        }

        private Document logical(Tag tag, NodeKind kind, Node node, int level) {
            return indented(level, Document.tagged(tag,
                operand(kind, node.child(0)),
                Document.text(" "), operator(kind.head()), Document.text(" "),
                operand(kind, node.child(1))));
        }

        private Document operand(NodeKind parent, Expr operand) {
            if (PlainTextRenderer.needsGrouping(parent, operand)) {
                return Document.run(paren("("), inline(operand), paren(")"));
            }
            return inline(operand);
        }

        private Document call(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder().add(at(node.child(0), level)).add(paren("("));
            interpose(builder, node.childrenFrom(1), comma(), Document.text(" "));
            builder.add(paren(")"));
            return builder.tagged(tag);
        }

        private Document topLevel(Tag tag, Node node, int level) {
            Document.Builder builder = new Document.Builder();
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) {
                    builder.add(NEWLINE);
                }
                builder.add(at(node.child(i), level));
            }
            return builder.tagged(tag);
        }
    }
}
