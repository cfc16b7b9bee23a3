package com.exprformat.core.model;

import java.math.BigInteger;
import java.util.List;

/**
 * A value of the expression tree: either an atom (leaf literal, symbol or quoted
 * reference), a container literal, or a {@link Node}.
 *
 * <p>The set of variants is closed. Renderers dispatch over it through
 * {@link ExprVisitor}, so adding a variant forces every renderer to handle it.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Expr call = Node.of(NodeKind.CALL, Expr.symbol("println"), Expr.string("hi"));
 * String text = new PlainTextRenderer().render(call);   // println("hi")
 * }</pre>
 *
 * @see Node
 * @see ExprVisitor
 */
public sealed interface Expr permits NilAtom, BooleanAtom, SignedInteger, UnsignedInteger,
    FloatingPoint, RationalAtom, CharacterAtom, StringAtom, Symbol, QuotedReference,
    TupleLiteral, ListLiteral, MappingLiteral, Pair, Node {

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param level indentation level passed through to the visitor
     * @param <R> result type
     * @return visitor result
     */
    <R> R accept(ExprVisitor<R> visitor, int level);

    static Expr nil() {
        return NilAtom.INSTANCE;
    }

    static Expr bool(boolean value) {
        return value ? BooleanAtom.TRUE : BooleanAtom.FALSE;
    }

    static Expr integer(long value) {
        return new SignedInteger(BigInteger.valueOf(value));
    }

    static Expr unsigned(long value) {
        return new UnsignedInteger(BigInteger.valueOf(value));
    }

    static Expr floating(double value) {
        return new FloatingPoint(value);
    }

    static Expr rational(long numerator, long denominator) {
        return new RationalAtom(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    static Expr character(int codePoint) {
        return new CharacterAtom(codePoint);
    }

    static Expr string(String value) {
        return new StringAtom(value);
    }

    static Symbol symbol(String name) {
        return new Symbol(name);
    }

    static Expr quoted(Expr inner) {
        return new QuotedReference(inner);
    }

    static Expr tuple(Expr... elements) {
        return new TupleLiteral(List.of(elements));
    }

    static Expr list(Expr... elements) {
        return new ListLiteral(List.of(elements));
    }

    static Pair pair(Expr first, Expr second) {
        return new Pair(first, second);
    }

    static Expr mapping(Pair... entries) {
        return new MappingLiteral(List.of(entries));
    }
}
