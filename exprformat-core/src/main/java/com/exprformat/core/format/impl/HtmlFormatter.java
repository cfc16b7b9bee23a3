package com.exprformat.core.format.impl;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exprformat.core.config.FormatterConfig;
import com.exprformat.core.format.ExpressionFormatter;
import com.exprformat.core.format.FormattedOutput;
import com.exprformat.core.markup.Document;
import com.exprformat.core.markup.MarkupFlattener;
import com.exprformat.core.model.Expr;
import com.exprformat.core.render.impl.MarkupRenderer;

/**
 * Formats a tree as syntax-highlighted HTML.
 *
 * <p>Runs {@link MarkupRenderer} and flattens the result with {@link MarkupFlattener}.
 * When {@code markup.wrap} is configured, the whole document is wrapped in an element
 * built from that selector, e.g. {@code pre#listing.code}.
 *
 * <p><b>Example output:</b>
 * <pre>{@code
 * <span class="call"><span class="variable">f</span><span class="punctuation paren">(</span>...
 * }</pre>
 */
public class HtmlFormatter implements ExpressionFormatter {

    private static final Logger log = LoggerFactory.getLogger(HtmlFormatter.class);

    private static final String FORMATTER_ID = "html";
    private static final String FORMATTER_DISPLAY_NAME = "HTML Markup Formatter";
    private static final String FILE_EXTENSION = "html";
    private static final String CONTENT_TYPE = "text/html";

    @Override
    public String getId() {
        return FORMATTER_ID;
    }

    @Override
    public String getDisplayName() {
        return FORMATTER_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public FormattedOutput format(Expr expr, int level, FormatterConfig config) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Formatting markup (indent width: {}, escape: {}, wrap: {})",
            config.indentWidth(), config.escapeText(), config.wrapSelector());

        Document document = new MarkupRenderer(config.indentation()).render(expr, level);
        String wrap = config.wrapSelector();
        if (wrap != null) {
            document = new Document.Tagged(wrap, List.of(document));
        }

        String content = new MarkupFlattener(config.escapeText()).flatten(document);
        return new FormattedOutput(FORMATTER_ID, content, CONTENT_TYPE, FILE_EXTENSION);
    }
}
