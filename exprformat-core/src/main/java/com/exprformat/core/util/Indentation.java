package com.exprformat.core.util;

/**
 * Computes whitespace prefixes from a nesting level.
 *
 * <p>One unit is {@code width} spaces; level {@code n} is {@code n} units. Both
 * renderers share this so their layouts stay identical.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Indentation indent = Indentation.DEFAULT;
 * indent.prefix(2);            // "    "
 * indent.line(1, "end");       // "  end"
 * indent.raw(1, 1);            // "    "
 * }</pre>
 *
 * @param width number of spaces per level
 */
public record Indentation(int width) {

    /** Default width of two spaces per level. */
    public static final int DEFAULT_WIDTH = 2;

    /** Indentation with {@link #DEFAULT_WIDTH}. */
    public static final Indentation DEFAULT = new Indentation(DEFAULT_WIDTH);

    /**
     * Compact constructor with validation.
     */
    public Indentation {
        if (width < 0) {
            throw new IllegalArgumentException("indent width must not be negative: " + width);
        }
    }

    /**
     * Returns the whitespace for {@code level}.
     *
     * @param level nesting level, not negative
     * @return {@code level * width} spaces
     */
    public String prefix(int level) {
        requireLevel(level);
        return " ".repeat(level * width);
    }

    /**
     * Returns {@code text} prefixed with the whitespace for {@code level}.
     *
     * @param level nesting level
     * @param text line content
     * @return indented text
     */
    public String line(int level, String text) {
        return prefix(level) + text;
    }

    /**
     * Returns only the whitespace for {@code level + delta}, for callers that emit
     * indentation as a separate fragment.
     *
     * @param level nesting level
     * @param delta offset added to the level
     * @return whitespace
     * @throws IllegalArgumentException if {@code level + delta} is negative
     */
    public String raw(int level, int delta) {
        return prefix(level + delta);
    }

    /**
     * Validates a render level.
     *
     * @param level level to check
     * @return the level
     * @throws IllegalArgumentException if the level is negative
     */
    public static int requireLevel(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("indent level must not be negative: " + level);
        }
        return level;
    }
}
