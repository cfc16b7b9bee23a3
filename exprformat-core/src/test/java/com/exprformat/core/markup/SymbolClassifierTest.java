package com.exprformat.core.markup;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SymbolClassifier}.
 */
class SymbolClassifierTest {

    @ParameterizedTest
    @CsvSource({
        "+, OP_ARITHMETIC",
        "//, OP_ARITHMETIC",
        "^, OP_ARITHMETIC",
        "&, OP_BITWISE",
        ">>>, OP_BITWISE",
        "==, OP_COMPARISON",
        "<=, OP_COMPARISON",
        "::, OP_MISC",
        "=>, OP_MISC",
        "..., OP_MISC",
        "x, VARIABLE",
        "foo_bar!, VARIABLE",
        "Int64, VARIABLE_TYPE",
        "Dict, VARIABLE_TYPE"
    })
    void classify_returnsExpectedTag(String symbol, Tag expected) {
        assertThat(SymbolClassifier.classify(symbol)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"++", "+=", "==="})
    void classify_partialOperatorMatch_isVariable(String symbol) {
        assertThat(SymbolClassifier.classify(symbol)).isEqualTo(Tag.VARIABLE);
    }
}
