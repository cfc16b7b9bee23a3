package com.exprformat.core.markup;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TagSelector}.
 */
class TagSelectorTest {

    @Test
    void parse_elementIdAndClasses() {
        TagSelector selector = TagSelector.parse("div#main.foo.bar");

        assertThat(selector.element()).isEqualTo("div");
        assertThat(selector.idAttribute()).contains("main");
        assertThat(selector.classes()).containsExactly("foo", "bar");
        assertThat(selector.classAttribute()).isEqualTo("foo bar");
    }

    @Test
    void parse_noElement_defaultsToSpan() {
        TagSelector selector = TagSelector.parse(".constant.number");

        assertThat(selector.element()).isEqualTo(TagSelector.DEFAULT_ELEMENT);
        assertThat(selector.idAttribute()).isEmpty();
        assertThat(selector.classes()).containsExactly("constant", "number");
    }

    @Test
    void parse_multipleIds_firstWins() {
        TagSelector selector = TagSelector.parse("p#one.a#two");

        assertThat(selector.idAttribute()).contains("one");
        assertThat(selector.classes()).containsExactly("a");
    }

    @Test
    void parse_bareElement_hasNoClasses() {
        TagSelector selector = TagSelector.parse("pre");

        assertThat(selector.element()).isEqualTo("pre");
        assertThat(selector.classes()).isEmpty();
        assertThat(selector.classAttribute()).isEmpty();
    }

    @Test
    void parse_emptySegments_areIgnored() {
        TagSelector selector = TagSelector.parse("span..a.");

        assertThat(selector.classes()).containsExactly("a");
    }
}
