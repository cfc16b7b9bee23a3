package com.exprformat.core.format.impl;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exprformat.core.config.FormatterConfig;
import com.exprformat.core.format.ExpressionFormatter;
import com.exprformat.core.format.FormattedOutput;
import com.exprformat.core.model.Expr;
import com.exprformat.core.render.impl.PlainTextRenderer;

/**
 * Formats a tree as indented plain text using {@link PlainTextRenderer}.
 */
public class TextFormatter implements ExpressionFormatter {

    private static final Logger log = LoggerFactory.getLogger(TextFormatter.class);

    private static final String FORMATTER_ID = "text";
    private static final String FORMATTER_DISPLAY_NAME = "Plain Text Formatter";
    private static final String FILE_EXTENSION = "txt";
    private static final String CONTENT_TYPE = "text/plain";

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

        log.debug("Formatting plain text (indent width: {}, level: {})", config.indentWidth(), level);
        String content = new PlainTextRenderer(config.indentation()).render(expr, level);
        return new FormattedOutput(FORMATTER_ID, content, CONTENT_TYPE, FILE_EXTENSION);
    }
}
