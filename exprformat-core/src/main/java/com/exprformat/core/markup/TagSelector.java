package com.exprformat.core.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A tag selector decomposed into element name, id and classes.
 *
 * <p>{@code div#main.foo.bar} parses to element {@code div}, id {@code main} and
 * classes {@code [foo, bar]}. A selector without a leading name gets
 * {@value #DEFAULT_ELEMENT}; only the first {@code #id} counts.
 *
 * @param element element name
 * @param id element id, may be null
 * @param classes class names in order
 */
public record TagSelector(String element, String id, List<String> classes) {

    /** Element used when the selector starts with {@code #} or {@code .}. */
    public static final String DEFAULT_ELEMENT = "span";

    public TagSelector {
        Objects.requireNonNull(element, "element must not be null");
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    /**
     * Parses a selector.
     *
     * @param selector selector text
     * @return the parsed selector
     */
    public static TagSelector parse(String selector) {
        Objects.requireNonNull(selector, "selector must not be null");

        String element = null;
        String id = null;
        List<String> classes = new ArrayList<>();

        char delimiter = 0;
        int start = 0;
        for (int i = 0; i <= selector.length(); i++) {
            boolean atEnd = i == selector.length();
            char c = atEnd ? 0 : selector.charAt(i);
            if (!atEnd && c != '#' && c != '.') {
                continue;
            }
            String segment = selector.substring(start, i);
            if (delimiter == 0) {
                element = segment;
            } else if (!segment.isEmpty()) {
                if (delimiter == '#') {
                    if (id == null) {
                        id = segment;
                    }
                } else {
                    classes.add(segment);
                }
            }
            delimiter = c;
            start = i + 1;
        }

        if (element == null || element.isEmpty()) {
            element = DEFAULT_ELEMENT;
        }
        return new TagSelector(element, id, classes);
    }

    public Optional<String> idAttribute() {
        return Optional.ofNullable(id);
    }

    /**
     * Returns the classes joined by single spaces, as used in a {@code class} attribute.
     *
     * @return class attribute value, empty when there are no classes
     */
    public String classAttribute() {
        return String.join(" ", classes);
    }
}
