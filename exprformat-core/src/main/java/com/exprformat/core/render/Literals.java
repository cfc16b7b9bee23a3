package com.exprformat.core.render;

import com.exprformat.core.model.BooleanAtom;
import com.exprformat.core.model.CharacterAtom;
import com.exprformat.core.model.FloatingPoint;
import com.exprformat.core.model.RationalAtom;
import com.exprformat.core.model.SignedInteger;
import com.exprformat.core.model.StringAtom;
import com.exprformat.core.model.UnsignedInteger;

/**
 * Spellings of literal atoms, shared by both renderers.
 */
public final class Literals {

    public static final String NIL = "nothing";

    private Literals() {
        // Utility class
    }

    public static String of(BooleanAtom bool) {
        return Boolean.toString(bool.value());
    }

    public static String of(SignedInteger integer) {
        return integer.value().toString();
    }

    public static String of(UnsignedInteger integer) {
        return "0x" + integer.value().toString(16);
    }

    /**
     * Spells a floating point value the way the language prints it:
     * {@code 1.5}, {@code 1.0e10}, {@code NaN}, {@code Inf}, {@code -Inf}.
     *
     * @param number the value
     * @return spelling
     */
    public static String of(FloatingPoint number) {
        double value = number.value();
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Inf" : "-Inf";
        }
        return Double.toString(value).replace('E', 'e');
    }

    public static String of(RationalAtom rational) {
        return rational.numerator() + "//" + rational.denominator();
    }

    public static String of(CharacterAtom character) {
        return "'" + character.text() + "'";
    }

    /**
     * Spells a string literal. The content is not escaped.
     *
     * @param string the literal
     * @return the content between double quotes
     */
    public static String of(StringAtom string) {
        return "\"" + string.value() + "\"";
    }
}
