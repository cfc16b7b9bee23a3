package com.exprformat.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Indentation}.
 */
class IndentationTest {

    @Test
    void prefix_defaultWidth_returnsTwoSpacesPerLevel() {
        assertThat(Indentation.DEFAULT.prefix(0)).isEmpty();
        assertThat(Indentation.DEFAULT.prefix(1)).isEqualTo("  ");
        assertThat(Indentation.DEFAULT.prefix(3)).isEqualTo("      ");
    }

    @Test
    void prefix_customWidth_scalesWithLevel() {
        assertThat(new Indentation(4).prefix(2)).hasSize(8).isBlank();
        assertThat(new Indentation(0).prefix(5)).isEmpty();
    }

    @Test
    void line_prependsPrefix() {
        assertThat(Indentation.DEFAULT.line(1, "end")).isEqualTo("  end");
    }

    @Test
    void raw_addsDelta() {
        assertThat(Indentation.DEFAULT.raw(1, 1)).isEqualTo("    ");
        assertThat(Indentation.DEFAULT.raw(2, -1)).isEqualTo("  ");
    }

    @Test
    void raw_negativeSum_throwsException() {
        assertThatThrownBy(() -> Indentation.DEFAULT.raw(0, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prefix_negativeLevel_throwsException() {
        assertThatThrownBy(() -> Indentation.DEFAULT.prefix(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("-1");
    }

    @Test
    void constructor_negativeWidth_throwsException() {
        assertThatThrownBy(() -> new Indentation(-2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
