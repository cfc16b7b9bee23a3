package com.exprformat.core.model;

/**
 * Visitor over the closed set of {@link Expr} variants.
 *
 * <p>Each method receives the indentation level the caller asked for. Implementations
 * are expected to be stateless so a single instance can render many trees.
 *
 * @param <R> result type
 */
public interface ExprVisitor<R> {

    R visitNil(NilAtom nil, int level);

    R visitBoolean(BooleanAtom bool, int level);

    R visitSignedInteger(SignedInteger integer, int level);

    R visitUnsignedInteger(UnsignedInteger integer, int level);

    R visitFloatingPoint(FloatingPoint number, int level);

    R visitRational(RationalAtom rational, int level);

    R visitCharacter(CharacterAtom character, int level);

    R visitString(StringAtom string, int level);

    R visitSymbol(Symbol symbol, int level);

    R visitQuotedReference(QuotedReference quoted, int level);

    R visitTuple(TupleLiteral tuple, int level);

    R visitList(ListLiteral list, int level);

    R visitMapping(MappingLiteral mapping, int level);

    R visitPair(Pair pair, int level);

    R visitNode(Node node, int level);
}
