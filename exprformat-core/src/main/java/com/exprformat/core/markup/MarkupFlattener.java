package com.exprformat.core.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Serializes a {@link Document} into a markup string.
 *
 * <p>Text fragments are copied through, run children are concatenated and each
 * tagged unit becomes an element whose name, id and classes come from its selector:
 * <pre>{@code
 * Tagged("span.constant.number", "42")   ->  <span class="constant number">42</span>
 * Tagged("div#main.foo.bar", "x")        ->  <div id="main" class="foo bar">x</div>
 * }</pre>
 *
 * <p>Units without any visible text produce no element at all. By default text is
 * not escaped, so the output is only safe for trusted input; construct the flattener
 * with {@code escapeText = true} to escape {@code & < > " '}.
 */
public class MarkupFlattener {

    private final boolean escapeText;

    /**
     * Creates a flattener that emits text unescaped.
     */
    public MarkupFlattener() {
        this(false);
    }

    /**
     * Creates a flattener.
     *
     * @param escapeText whether to escape reserved markup characters in text and attributes
     */
    public MarkupFlattener(boolean escapeText) {
        this.escapeText = escapeText;
    }

    public boolean isEscapeText() {
        return escapeText;
    }

    /**
     * Flattens a document.
     *
     * @param document document to serialize
     * @return markup string
     */
    public String flatten(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        StringBuilder sb = new StringBuilder();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(document);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof Document.Text text) {
                sb.append(escapeText ? escape(text.value()) : text.value());
            } else if (next instanceof Document.Run run) {
                pushInOrder(run.children(), pending);
            } else if (next instanceof Document.Tagged tagged) {
                pending.push(openElement(tagged, sb));
                pushInOrder(tagged.children(), pending);
            } else if (next instanceof OpenElement open) {
                closeElement(open, sb);
            }
        }
        return sb.toString();
    }

    private static void pushInOrder(List<Document> children, Deque<Object> pending) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    private OpenElement openElement(Document.Tagged tagged, StringBuilder sb) {
        TagSelector selector = TagSelector.parse(tagged.tag());
        int start = sb.length();

        sb.append('<').append(selector.element());
        selector.idAttribute().ifPresent(id -> appendAttribute(sb, "id", id));
        if (!selector.classes().isEmpty()) {
            appendAttribute(sb, "class", selector.classAttribute());
        }
        sb.append('>');
        return new OpenElement(selector.element(), start, sb.length());
    }

    private static void closeElement(OpenElement open, StringBuilder sb) {
        if (sb.length() == open.contentStart()) {
            // nothing visible inside: drop the element
            sb.setLength(open.start());
            return;
        }
        sb.append("</").append(open.element()).append('>');
    }

    private void appendAttribute(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"")
            .append(escapeText ? escape(value) : value)
            .append('"');
    }

    /**
     * Escapes the characters that are reserved in markup.
     *
     * @param text raw text
     * @return escaped text
     */
    public static String escape(String text) {
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&#39;";
                default -> null;
            };
            if (replacement == null) {
                if (sb != null) {
                    sb.append(c);
                }
                continue;
            }
            if (sb == null) {
                sb = new StringBuilder(text.length() + 16);
                sb.append(text, 0, i);
            }
            sb.append(replacement);
        }
        return sb == null ? text : sb.toString();
    }

    /**
     * An element whose start tag is written and whose content is still pending.
     */
    private record OpenElement(String element, int start, int contentStart) {
    }
}
