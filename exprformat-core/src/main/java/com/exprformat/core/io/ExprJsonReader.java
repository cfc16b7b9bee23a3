package com.exprformat.core.io;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.exprformat.core.model.CharacterAtom;
import com.exprformat.core.model.Expr;
import com.exprformat.core.model.FloatingPoint;
import com.exprformat.core.model.ListLiteral;
import com.exprformat.core.model.MappingLiteral;
import com.exprformat.core.model.Node;
import com.exprformat.core.model.Pair;
import com.exprformat.core.model.QuotedReference;
import com.exprformat.core.model.RationalAtom;
import com.exprformat.core.model.SignedInteger;
import com.exprformat.core.model.StringAtom;
import com.exprformat.core.model.Symbol;
import com.exprformat.core.model.TupleLiteral;
import com.exprformat.core.model.UnsignedInteger;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads an expression tree from its JSON representation.
 *
 * <p>Scalars map directly: {@code null} is Nil, booleans are Booleans, integral numbers
 * are SignedIntegers, fractional numbers are FloatingPoints and bare strings are Symbols.
 * Everything else is a single-key object:
 *
 * <pre>{@code
 * {"str": "hi"}          {"char": "a"}           {"uint": 255} or {"uint": "0xff"}
 * {"rational": [1, 2]}   {"quote": "x"}          {"sym": "x"}
 * {"tuple": [1, 2]}      {"list": [1, 2]}        {"dict": [["a", 1], ["b", 2]]}
 * {"pair": ["a", 1]}     {"head": "call", "args": ["f", 1]}
 * }</pre>
 *
 * <p>A node head is kept as given, so unknown heads are read fine and only fail when
 * rendered (as an inline error marker).
 */
public class ExprJsonReader {

    private static final Logger log = LoggerFactory.getLogger(ExprJsonReader.class);

    private static final String HEX_PREFIX = "0x";

    private final ObjectMapper mapper;

    public ExprJsonReader() {
        this(new ObjectMapper());
    }

    public ExprJsonReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Reads a tree from a JSON file.
     *
     * @param path JSON file
     * @return the tree
     * @throws IOException if the file cannot be read or is not valid JSON
     * @throws MalformedTreeException if the JSON does not describe a tree
     */
    public Expr read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        log.debug("Reading expression tree from {}", path);
        return fromJson(mapper.readTree(path.toFile()));
    }

    /**
     * Reads a tree from a JSON string.
     *
     * @param json JSON text
     * @return the tree
     * @throws IOException if the text is not valid JSON
     * @throws MalformedTreeException if the JSON does not describe a tree
     */
    public Expr read(String json) throws IOException {
        Objects.requireNonNull(json, "json must not be null");
        return fromJson(mapper.readTree(json));
    }

    /**
     * Converts an already parsed JSON value into a tree.
     *
     * @param json JSON value
     * @return the tree
     * @throws MalformedTreeException if the JSON does not describe a tree
     */
    public Expr fromJson(JsonNode json) {
        if (json == null || json.isMissingNode()) {
            throw new MalformedTreeException("", "no JSON content");
        }
        return convert(json, JsonPointer.empty());
    }

    private Expr convert(JsonNode json, JsonPointer pointer) {
        if (json.isNull()) {
            return Expr.nil();
        }
        if (json.isBoolean()) {
            return Expr.bool(json.booleanValue());
        }
        if (json.isIntegralNumber()) {
            return new SignedInteger(json.bigIntegerValue());
        }
        if (json.isNumber()) {
            return new FloatingPoint(json.doubleValue());
        }
        if (json.isTextual()) {
            return symbol(json.textValue(), pointer);
        }
        if (json.isObject()) {
            return convertObject(json, pointer);
        }
        throw new MalformedTreeException(pointer.toString(), "unexpected JSON " + json.getNodeType());
    }

    private Expr convertObject(JsonNode json, JsonPointer pointer) {
        if (json.has("head")) {
            return node(json, pointer);
        }
        if (json.size() != 1) {
            throw new MalformedTreeException(pointer.toString(), "expected a single-key object or a node, got " + json.size() + " keys");
        }

        Map.Entry<String, JsonNode> entry = json.fields().next();
        String key = entry.getKey();
        JsonNode value = entry.getValue();
        JsonPointer at = pointer.appendProperty(key);

        return switch (key) {
            case "str" -> new StringAtom(text(value, at));
            case "sym" -> symbol(text(value, at), at);
            case "char" -> character(value, at);
            case "uint" -> unsigned(value, at);
            case "rational" -> rational(value, at);
            case "quote" -> new QuotedReference(convert(value, at));
            case "tuple" -> new TupleLiteral(elements(value, at));
            case "list" -> new ListLiteral(elements(value, at));
            case "dict" -> mapping(value, at);
            case "pair" -> pair(value, at);
            default -> throw new MalformedTreeException(at.toString(), "unknown literal key '" + key + "'");
        };
    }

    private Node node(JsonNode json, JsonPointer pointer) {
        String head = text(json.get("head"), pointer.appendProperty("head"));
        JsonNode args = json.get("args");
        List<Expr> children = args == null || args.isNull()
            ? List.of()
            : elements(args, pointer.appendProperty("args"));
        return new Node(head, children);
    }

    private List<Expr> elements(JsonNode json, JsonPointer pointer) {
        if (!json.isArray()) {
            throw new MalformedTreeException(pointer.toString(), "expected an array");
        }
        List<Expr> result = new ArrayList<>(json.size());
        Iterator<JsonNode> items = json.elements();
        int index = 0;
        while (items.hasNext()) {
            result.add(convert(items.next(), pointer.appendIndex(index)));
            index++;
        }
        return result;
    }

    private MappingLiteral mapping(JsonNode json, JsonPointer pointer) {
        if (!json.isArray()) {
            throw new MalformedTreeException(pointer.toString(), "expected an array of [key, value] entries");
        }
        List<Pair> entries = new ArrayList<>(json.size());
        for (int i = 0; i < json.size(); i++) {
            entries.add(pair(json.get(i), pointer.appendIndex(i)));
        }
        return new MappingLiteral(entries);
    }

    private Pair pair(JsonNode json, JsonPointer pointer) {
        if (!json.isArray() || json.size() != 2) {
            throw new MalformedTreeException(pointer.toString(), "expected a two-element array");
        }
        return new Pair(convert(json.get(0), pointer.appendIndex(0)), convert(json.get(1), pointer.appendIndex(1)));
    }

    private RationalAtom rational(JsonNode json, JsonPointer pointer) {
        if (!json.isArray() || json.size() != 2
                || !json.get(0).isIntegralNumber() || !json.get(1).isIntegralNumber()) {
            throw new MalformedTreeException(pointer.toString(), "expected [numerator, denominator] integers");
        }
        return new RationalAtom(json.get(0).bigIntegerValue(), json.get(1).bigIntegerValue());
    }

    private CharacterAtom character(JsonNode json, JsonPointer pointer) {
        String value = text(json, pointer);
        if (value.codePointCount(0, value.length()) != 1) {
            throw new MalformedTreeException(pointer.toString(), "expected exactly one character, got \"" + value + "\"");
        }
        return new CharacterAtom(value.codePointAt(0));
    }

    private UnsignedInteger unsigned(JsonNode json, JsonPointer pointer) {
        BigInteger value;
        if (json.isIntegralNumber()) {
            value = json.bigIntegerValue();
        } else if (json.isTextual() && json.textValue().startsWith(HEX_PREFIX)) {
            try {
                value = new BigInteger(json.textValue().substring(HEX_PREFIX.length()), 16);
            } catch (NumberFormatException e) {
                throw new MalformedTreeException(pointer.toString(), "invalid hex literal \"" + json.textValue() + "\"", e);
            }
        } else {
            throw new MalformedTreeException(pointer.toString(), "expected an integer or a 0x hex string");
        }
        if (value.signum() < 0) {
            throw new MalformedTreeException(pointer.toString(), "unsigned value must not be negative");
        }
        return new UnsignedInteger(value);
    }

    private Symbol symbol(String name, JsonPointer pointer) {
        if (name.isEmpty()) {
            throw new MalformedTreeException(pointer.toString(), "symbol name must not be empty");
        }
        return new Symbol(name);
    }

    private String text(JsonNode json, JsonPointer pointer) {
        if (json == null || !json.isTextual()) {
            throw new MalformedTreeException(pointer.toString(), "expected a string");
        }
        return json.textValue();
    }

    /**
     * Thrown when well-formed JSON does not describe an expression tree.
     */
    public static class MalformedTreeException extends RuntimeException {

        private final String pointer;

        public MalformedTreeException(String pointer, String message) {
            super(describe(pointer, message));
            this.pointer = pointer;
        }

        public MalformedTreeException(String pointer, String message, Throwable cause) {
            super(describe(pointer, message), cause);
            this.pointer = pointer;
        }

        /**
         * Returns the JSON pointer of the offending value ({@code ""} for the root).
         *
         * @return JSON pointer
         */
        public String getPointer() {
            return pointer;
        }

        private static String describe(String pointer, String message) {
            return "Malformed tree at '" + (pointer.isEmpty() ? "/" : pointer) + "': " + message;
        }
    }
}
