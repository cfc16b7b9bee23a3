package com.exprformat.core.markup;

import com.exprformat.core.model.NodeKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tag taxonomy: semantic categories and the markup selector used for each.
 *
 * <p>A selector is an element name followed by dot-separated classes, e.g.
 * {@code span.constant.number.hex} becomes
 * {@code <span class="constant number hex">}. The table is fixed at class
 * initialization and never changes.
 */
public enum Tag {
    // punctuation
    PAREN("paren", "span.punctuation.paren"),
    COMMA("comma", "span.punctuation.comma"),

    // constants
    NIL("nil", "span.constant.nil"),
    BOOL("bool", "span.constant.bool"),
    NUMBER("number", "span.constant.number"),
    HEX_NUMBER("hexnumber", "span.constant.number.hex"),
    DECIMAL_NUMBER("decnumber", "span.constant.number.decimal"),
    RATIONAL("rational", "span.constant.rational"),
    CHAR("char", "span.constant.char"),
    STRING("string", "span.constant.string"),
    KEYWORD("keyword", "span.constant.keyword"),

    VARIABLE("variable", "span.variable"),
    VARIABLE_TYPE("type", "span.variable.type"),
    // reserved words such as "if" or "end"
    RESERVED("reserved", "span.reserved"),

    QUOTED("quote", "span.quoted"),
    UNQUOTED("unquote", "span.unquoted"),

    // operators
    OP_DOT("dot", "span.operator.dot"),
    OP_MISC("opmisc", "span.operator.misc"),
    OP_ARITHMETIC("oparith", "span.operator.arithmetic"),
    OP_BITWISE("opbit", "span.operator.bitmath"),
    OP_COMPARISON("opcomp", "span.operator.comparison"),

    // collections
    PAIR("pair", "span.ds.pair"),
    TUPLE("tuple", "span.ds.tuple"),
    VECT("vect", "span.ds.vect"),
    DICT("dict", "span.ds.dict"),

    // structural forms
    BLOCK("block", "span.block"),
    IF("if", "span.if"),
    ASSIGNMENT("assignment", "span.def"),
    COMPARISON("comparison", "span.comparison"),
    FUNCTION("function", "span.function"),
    MACRO("macro", "span.macro"),
    SPLAT("splat", "span.splat"),
    LET("let", "span.let"),
    LAMBDA("lambda", "span.lambda"),
    REF("ref", "span.ref"),
    RANGE("range", "span.range"),
    MODULE("module", "span.module"),
    IMPORT("import", "span.import"),
    EXPORT("export", "span.export"),
    ACCESS("access", "span.access"),
    TYPE_ANNOTATION("typestring", "span.typestring"),
    CURLY("curly", "span.curly"),
    LOGICAL("logical", "span.logical"),
    CALL("call", "span.call"),
    MACRO_CALL("macrocall", "span.macrocall"),
    TOP_LEVEL("toplevel", "span.toplevel"),

    ERROR("error", "span.error");

    private static final Map<String, Tag> BY_CATEGORY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Tag::category, Function.identity()));

    private static final Map<NodeKind, Tag> BY_KIND;

    static {
        Map<NodeKind, Tag> byKind = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            byKind.put(kind, tagFor(kind));
        }
        BY_KIND = Collections.unmodifiableMap(byKind);
    }

    private final String category;
    private final String selector;

    Tag(String category, String selector) {
        this.category = category;
        this.selector = selector;
    }

    /**
     * Returns the category name, e.g. {@code hexnumber}.
     *
     * @return category name
     */
    public String category() {
        return category;
    }

    /**
     * Returns the markup selector, e.g. {@code span.constant.number.hex}.
     *
     * @return selector
     */
    public String selector() {
        return selector;
    }

    /**
     * Looks up a tag by category name.
     *
     * @param category category name
     * @return the tag, or empty if unknown
     */
    public static Optional<Tag> forCategory(String category) {
        return Optional.ofNullable(BY_CATEGORY.get(category));
    }

    /**
     * Returns the tag wrapping the markup of a node of the given kind.
     *
     * @param kind node kind
     * @return the tag for that kind
     */
    public static Tag forKind(NodeKind kind) {
        return BY_KIND.get(kind);
    }

    private static Tag tagFor(NodeKind kind) {
        return switch (kind) {
            case RATIONAL -> RATIONAL;
            case PAIR -> PAIR;
            case TUPLE -> TUPLE;
            case LIST -> VECT;
            case MAPPING -> DICT;
            case QUOTE -> QUOTED;
            case UNQUOTE -> UNQUOTED;
            case SPLAT -> SPLAT;
            case BLOCK -> BLOCK;
            case CONDITIONAL -> IF;
            case COMPARISON -> COMPARISON;
            case LET -> LET;
            case FUNCTION -> FUNCTION;
            case MACRO -> MACRO;
            case LAMBDA -> LAMBDA;
            case ASSIGNMENT -> ASSIGNMENT;
            case INDEXING -> REF;
            case RANGE -> RANGE;
            case MODULE -> MODULE;
            case IMPORT, USING -> IMPORT;
            case EXPORT -> EXPORT;
            case MEMBER_ACCESS -> ACCESS;
            case TYPE_ANNOTATION -> TYPE_ANNOTATION;
            case PARAMETERIZATION -> CURLY;
            case AND, OR -> LOGICAL;
            case CALL -> CALL;
            case MACRO_CALL -> MACRO_CALL;
            case TOP_LEVEL -> TOP_LEVEL;
        };
    }
}
