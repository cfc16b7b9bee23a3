package com.exprformat.core.markup;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Picks the highlighting tag for a bare symbol from its spelling.
 *
 * <p>Operator classes are tried in order (arithmetic, bitwise, comparison, misc) and
 * the first full match wins. Anything else is a variable, or a type when the first
 * character is uppercase.
 */
public final class SymbolClassifier {

    private static final List<OperatorClass> OPERATOR_CLASSES = List.of(
        new OperatorClass(Tag.OP_ARITHMETIC, Pattern.compile("\\+|-|\\*|/|\\\\|\\^|%|//")),
        new OperatorClass(Tag.OP_BITWISE, Pattern.compile("~|&|\\||\\$|>>|<<|>>>")),
        new OperatorClass(Tag.OP_COMPARISON, Pattern.compile("==|!=|<|>|<=|>=")),
        new OperatorClass(Tag.OP_MISC, Pattern.compile(":|\\.|::|=>|\\.\\.\\."))
    );

    private SymbolClassifier() {
        // Utility class
    }

    /**
     * Classifies a symbol spelling.
     *
     * @param name symbol spelling, not empty
     * @return the tag to highlight it with
     */
    public static Tag classify(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (OperatorClass operatorClass : OPERATOR_CLASSES) {
            if (operatorClass.pattern().matcher(name).matches()) {
                return operatorClass.tag();
            }
        }
        if (!name.isEmpty() && Character.isUpperCase(name.codePointAt(0))) {
            return Tag.VARIABLE_TYPE;
        }
        return Tag.VARIABLE;
    }

    private record OperatorClass(Tag tag, Pattern pattern) {}
}
