package com.exprformat.core.format;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of {@link ExpressionFormatter} implementations registered through SPI.
 */
public final class Formatters {

    private Formatters() {
        // Utility class
    }

    /**
     * Returns all registered formatters, ordered by id.
     *
     * @return registered formatters
     */
    public static List<ExpressionFormatter> available() {
        return ServiceLoader.load(ExpressionFormatter.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(ExpressionFormatter::getId))
            .toList();
    }

    /**
     * Finds a registered formatter by id (case-insensitive).
     *
     * @param id formatter id
     * @return the formatter, or empty if none has that id
     */
    public static Optional<ExpressionFormatter> find(String id) {
        return available().stream()
            .filter(formatter -> formatter.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
