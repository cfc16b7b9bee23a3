package com.exprformat.core.config;

import com.exprformat.core.util.Indentation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for ExprFormat.
 *
 * <p>Loaded from {@code exprformat.yaml}. Every section is optional; missing values
 * fall back to the defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * indent:
 *   width: 4
 *
 * markup:
 *   escapeText: true
 *   wrap: "pre.exprformat"
 * }</pre>
 *
 * @param indent indentation settings
 * @param markup markup output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormatterConfig(
    @JsonProperty("indent") IndentConfig indent,
    @JsonProperty("markup") MarkupConfig markup
) {
    /**
     * Creates the default configuration: two-space indentation, unescaped markup,
     * no wrapping element.
     *
     * @return default configuration
     */
    public static FormatterConfig defaults() {
        return new FormatterConfig(
            new IndentConfig(Indentation.DEFAULT_WIDTH),
            new MarkupConfig(false, null)
        );
    }

    /**
     * Returns the effective indentation width.
     *
     * @return configured width or {@link Indentation#DEFAULT_WIDTH}
     */
    public int indentWidth() {
        return indent != null && indent.width() != null ? indent.width() : Indentation.DEFAULT_WIDTH;
    }

    /**
     * Returns the indentation unit to render with.
     *
     * @return indentation
     */
    public Indentation indentation() {
        return new Indentation(indentWidth());
    }

    /**
     * Returns whether markup text should be escaped.
     *
     * @return true if escaping is enabled
     */
    public boolean escapeText() {
        return markup != null && Boolean.TRUE.equals(markup.escapeText());
    }

    /**
     * Returns the selector of the element wrapping the whole markup output, if any.
     *
     * @return wrapping selector, or null for none
     */
    public String wrapSelector() {
        return markup == null || markup.wrap() == null || markup.wrap().isBlank() ? null : markup.wrap();
    }

    /**
     * Indentation settings.
     *
     * @param width spaces per indentation level, not negative
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndentConfig(
        @JsonProperty("width") Integer width
    ) {
        public IndentConfig {
            if (width != null && width < 0) {
                throw new IllegalArgumentException("indent.width must not be negative: " + width);
            }
        }
    }

    /**
     * Markup output settings.
     *
     * @param escapeText escape {@code & < > " '} in text fragments
     * @param wrap optional selector (e.g. {@code pre.code}) wrapping the whole output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MarkupConfig(
        @JsonProperty("escapeText") Boolean escapeText,
        @JsonProperty("wrap") String wrap
    ) {}
}
