package com.exprformat.core.format.impl;

import com.exprformat.core.config.FormatterConfig;
import com.exprformat.core.format.FormattedOutput;
import com.exprformat.core.model.Expr;
import com.exprformat.core.model.Node;
import com.exprformat.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HtmlFormatter}.
 */
class HtmlFormatterTest {

    private final HtmlFormatter formatter = new HtmlFormatter();

    private final Node comparison = Node.of(NodeKind.COMPARISON,
        Expr.symbol("a"), Expr.symbol("<"), Expr.symbol("b"));

    @Test
    void format_defaults_emitsUnescapedMarkup() {
        FormattedOutput output = formatter.format(Expr.symbol("x"), FormatterConfig.defaults());

        assertThat(output.formatterId()).isEqualTo("html");
        assertThat(output.contentType()).isEqualTo("text/html");
        assertThat(output.fileExtension()).isEqualTo("html");
        assertThat(output.content()).isEqualTo("<span class=\"variable\">x</span>");
    }

    @Test
    void format_defaults_leaveOperatorsRaw() {
        String content = formatter.format(comparison, FormatterConfig.defaults()).content();

        assertThat(content).contains("<span class=\"operator comparison\"><</span>");
    }

    @Test
    void format_escapeEnabled_escapesOperators() {
        FormatterConfig config = new FormatterConfig(null, new FormatterConfig.MarkupConfig(true, null));

        String content = formatter.format(comparison, config).content();

        assertThat(content)
            .contains("<span class=\"operator comparison\">&lt;</span>")
            .doesNotContain("><<");
    }

    @Test
    void format_wrapSelector_wrapsWholeOutput() {
        FormatterConfig config = new FormatterConfig(null, new FormatterConfig.MarkupConfig(false, "pre#listing.code"));

        String content = formatter.format(Expr.integer(42), config).content();

        assertThat(content).isEqualTo(
            "<pre id=\"listing\" class=\"code\"><span class=\"constant number\">42</span></pre>");
    }

    @Test
    void format_unknownHead_emitsErrorSpan() {
        String content = formatter.format(Node.of("weird"), FormatterConfig.defaults()).content();

        assertThat(content).isEqualTo("<span class=\"error\">ERROR: could not print Expr(:weird) :ERROR</span>");
    }
}
