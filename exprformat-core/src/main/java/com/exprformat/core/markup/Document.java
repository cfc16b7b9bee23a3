package com.exprformat.core.markup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Intermediate result of markup rendering: text fragments grouped into tagged and
 * untagged units.
 *
 * <p>A document is turned into a markup string by {@link MarkupFlattener}. Callers
 * that need their own serialization can walk the three variants directly.
 */
public sealed interface Document permits Document.Text, Document.Tagged, Document.Run {

    /** Document with no content. */
    Document EMPTY = new Run(List.of());

    /**
     * Returns the visible text of this document, i.e. all text fragments in order
     * without any markup.
     *
     * @return visible text
     */
    default String text() {
        StringBuilder sb = new StringBuilder();
        Deque<Document> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Document doc = pending.pop();
            if (doc instanceof Text text) {
                sb.append(text.value());
            } else if (doc instanceof Tagged tagged) {
                pushInOrder(tagged.children(), pending);
            } else if (doc instanceof Run run) {
                pushInOrder(run.children(), pending);
            }
        }
        return sb.toString();
    }

    /**
     * Pushes children so that the first one is popped first.
     */
    private static void pushInOrder(List<Document> children, Deque<Document> pending) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    static Text text(String value) {
        return new Text(value);
    }

    static Tagged tagged(Tag tag, Document... children) {
        return new Tagged(tag.selector(), List.of(children));
    }

    static Tagged tagged(Tag tag, String text) {
        return new Tagged(tag.selector(), List.of(new Text(text)));
    }

    static Tagged tagged(Tag tag, List<Document> children) {
        return new Tagged(tag.selector(), children);
    }

    static Document run(Document... children) {
        return new Run(List.of(children));
    }

    static Document run(List<Document> children) {
        return new Run(children);
    }

    /**
     * Literal text fragment, emitted as-is.
     *
     * @param value fragment text
     */
    record Text(String value) implements Document {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * Unit labeled with a selector such as {@code span.constant.number}.
     *
     * @param tag selector, parsed by {@link TagSelector#parse(String)}
     * @param children content in order
     */
    record Tagged(String tag, List<Document> children) implements Document {
        public Tagged {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(children, "children must not be null");
            children = List.copyOf(children);
        }
    }

    /**
     * Ordered, untagged grouping.
     *
     * @param children content in order
     */
    record Run(List<Document> children) implements Document {
        public Run {
            Objects.requireNonNull(children, "children must not be null");
            children = List.copyOf(children);
        }
    }

    /**
     * Collects documents into a list, dropping empty text fragments.
     */
    final class Builder {
        private final List<Document> parts = new ArrayList<>();

        public Builder add(Document doc) {
            if (!(doc instanceof Text text && text.value().isEmpty())) {
                parts.add(doc);
            }
            return this;
        }

        public Builder add(String text) {
            return add(new Text(text));
        }

        public Builder add(Tag tag, String text) {
            return add(Document.tagged(tag, text));
        }

        public List<Document> parts() {
            return List.copyOf(parts);
        }

        public Tagged tagged(Tag tag) {
            return new Tagged(tag.selector(), parts);
        }

        public Document run() {
            return parts.size() == 1 ? parts.get(0) : new Run(parts);
        }
    }
}
