package com.exprformat.core.format;

import com.exprformat.core.config.FormatterConfig;
import com.exprformat.core.model.Expr;

/**
 * Interface for formatters that turn an expression tree into a finished output document.
 *
 * <p>A formatter picks a renderer, applies the {@link FormatterConfig} and packages the
 * result as a {@link FormattedOutput}. Formatters are discovered via Java Service
 * Provider Interface (SPI), so callers can select one by {@link #getId()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.exprformat.core.format.ExpressionFormatter}
 *
 * @see Formatters
 * @see FormattedOutput
 */
public interface ExpressionFormatter {

    /**
     * Returns unique identifier for this formatter (e.g. "text", "html").
     *
     * @return unique formatter identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this formatter.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for formatted output, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the media type of formatted output.
     *
     * @return content type, e.g. {@code text/html}
     */
    String getContentType();

    /**
     * Formats a tree at the given indentation level.
     *
     * @param expr tree to format
     * @param level indentation level, not negative
     * @param config configuration settings
     * @return formatted output
     * @throws IllegalArgumentException if {@code level} is negative
     */
    FormattedOutput format(Expr expr, int level, FormatterConfig config);

    /**
     * Formats a tree at level 0.
     *
     * @param expr tree to format
     * @param config configuration settings
     * @return formatted output
     */
    default FormattedOutput format(Expr expr, FormatterConfig config) {
        return format(expr, 0, config);
    }
}
