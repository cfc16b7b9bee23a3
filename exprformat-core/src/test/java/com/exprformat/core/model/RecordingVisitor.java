package com.exprformat.core.model;

/**
 * Visitor that answers with the name of the visit method it received and the level,
 * e.g. {@code "visitNode@3"}.
 */
class RecordingVisitor implements ExprVisitor<String> {

    private static String seen(String method, int level) {
        return method + "@" + level;
    }

    @Override
    public String visitNil(NilAtom nil, int level) {
        return seen("visitNil", level);
    }

    @Override
    public String visitBoolean(BooleanAtom bool, int level) {
        return seen("visitBoolean", level);
    }

    @Override
    public String visitSignedInteger(SignedInteger integer, int level) {
        return seen("visitSignedInteger", level);
    }

    @Override
    public String visitUnsignedInteger(UnsignedInteger integer, int level) {
        return seen("visitUnsignedInteger", level);
    }

    @Override
    public String visitFloatingPoint(FloatingPoint number, int level) {
        return seen("visitFloatingPoint", level);
    }

    @Override
    public String visitRational(RationalAtom rational, int level) {
        return seen("visitRational", level);
    }

    @Override
    public String visitCharacter(CharacterAtom character, int level) {
        return seen("visitCharacter", level);
    }

    @Override
    public String visitString(StringAtom string, int level) {
        return seen("visitString", level);
    }

    @Override
    public String visitSymbol(Symbol symbol, int level) {
        return seen("visitSymbol", level);
    }

    @Override
    public String visitQuotedReference(QuotedReference quoted, int level) {
        return seen("visitQuotedReference", level);
    }

    @Override
    public String visitTuple(TupleLiteral tuple, int level) {
        return seen("visitTuple", level);
    }

    @Override
    public String visitList(ListLiteral list, int level) {
        return seen("visitList", level);
    }

    @Override
    public String visitMapping(MappingLiteral mapping, int level) {
        return seen("visitMapping", level);
    }

    @Override
    public String visitPair(Pair pair, int level) {
        return seen("visitPair", level);
    }

    @Override
    public String visitNode(Node node, int level) {
        return seen("visitNode", level);
    }
}
