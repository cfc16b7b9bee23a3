package com.exprformat.core.model;

/**
 * Character literal, stored as a Unicode code point.
 *
 * @param codePoint the character
 */
public record CharacterAtom(int codePoint) implements Expr {

    public CharacterAtom {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("invalid code point: " + codePoint);
        }
    }

    /**
     * Returns the character as a string (one or two UTF-16 units).
     *
     * @return the character text
     */
    public String text() {
        return new String(Character.toChars(codePoint));
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor, int level) {
        return visitor.visitCharacter(this, level);
    }
}
