package com.exprformat.core.markup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkupFlattener}.
 */
class MarkupFlattenerTest {

    private final MarkupFlattener flattener = new MarkupFlattener();

    @Test
    void flatten_taggedText_emitsElementWithClasses() {
        String html = flattener.flatten(Document.tagged(Tag.NUMBER, "42"));

        assertThat(html).isEqualTo("<span class=\"constant number\">42</span>");
    }

    @Test
    void flatten_selectorWithId_emitsIdAndClasses() {
        Document doc = new Document.Tagged("div#main.foo.bar", List.of(Document.text("x")));

        assertThat(flattener.flatten(doc)).isEqualTo("<div id=\"main\" class=\"foo bar\">x</div>");
    }

    @Test
    void flatten_selectorWithoutClasses_omitsClassAttribute() {
        Document doc = new Document.Tagged("pre", List.of(Document.text("x")));

        assertThat(flattener.flatten(doc)).isEqualTo("<pre>x</pre>");
    }

    @Test
    void flatten_nestedUnits_concatenateInOrder() {
        Document doc = Document.tagged(Tag.TUPLE,
            Document.tagged(Tag.PAREN, "("),
            Document.tagged(Tag.NUMBER, "1"),
            Document.run(Document.text(" "), Document.tagged(Tag.VARIABLE, "x")),
            Document.tagged(Tag.PAREN, ")"));

        assertThat(flattener.flatten(doc)).isEqualTo(
            "<span class=\"ds tuple\">"
                + "<span class=\"punctuation paren\">(</span>"
                + "<span class=\"constant number\">1</span>"
                + " <span class=\"variable\">x</span>"
                + "<span class=\"punctuation paren\">)</span>"
                + "</span>");
    }

    @Test
    void flatten_emptyUnits_areDropped() {
        Document doc = Document.run(
            Document.tagged(Tag.BLOCK, Document.tagged(Tag.NUMBER, "")),
            Document.text("a"),
            Document.EMPTY);

        assertThat(flattener.flatten(doc)).isEqualTo("a");
    }

    @Test
    void flatten_defaultMode_doesNotEscape() {
        Document doc = Document.tagged(Tag.OP_COMPARISON, "<");

        assertThat(flattener.flatten(doc)).isEqualTo("<span class=\"operator comparison\"><</span>");
    }

    @Test
    void flatten_escapingEnabled_escapesTextAndAttributes() {
        MarkupFlattener escaping = new MarkupFlattener(true);
        Document doc = Document.run(
            Document.tagged(Tag.STRING, "\"a&b\""),
            new Document.Tagged("span.x'y", List.of(Document.text("<'>"))));

        assertThat(escaping.isEscapeText()).isTrue();
        assertThat(escaping.flatten(doc)).isEqualTo(
            "<span class=\"constant string\">&quot;a&amp;b&quot;</span>"
                + "<span class=\"x&#39;y\">&lt;&#39;&gt;</span>");
    }

    @Test
    void escape_plainText_returnsSameInstance() {
        String text = "plain text";

        assertThat(MarkupFlattener.escape(text)).isSameAs(text);
    }

    @Test
    void text_returnsVisibleTextOnly() {
        Document doc = Document.tagged(Tag.CALL,
            Document.tagged(Tag.VARIABLE, "f"),
            Document.tagged(Tag.PAREN, "("),
            Document.tagged(Tag.PAREN, ")"));

        assertThat(doc.text()).isEqualTo("f()");
    }

    @Test
    void builder_dropsEmptyText() {
        Document.Builder builder = new Document.Builder().add("").add("a").add(Tag.COMMA, ",");

        assertThat(builder.parts()).hasSize(2);
        assertThat(builder.run().text()).isEqualTo("a,");
    }

    @Test
    void flatten_deeplyNestedUnits_closesEveryElement() {
        int depth = 10_000;
        Document doc = Document.text("x");
        for (int i = 0; i < depth; i++) {
            doc = new Document.Tagged("b", List.of(doc));
        }

        assertThat(flattener.flatten(doc)).isEqualTo("<b>".repeat(depth) + "x" + "</b>".repeat(depth));
        assertThat(doc.text()).isEqualTo("x");
    }

    @Test
    void flatten_deeplyNestedEmptyUnits_emitsNothing() {
        Document doc = Document.text("");
        for (int i = 0; i < 10_000; i++) {
            doc = Document.run(new Document.Tagged("b", List.of(doc)));
        }

        assertThat(flattener.flatten(doc)).isEmpty();
    }
}
