package com.exprformat.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the expression model records.
 */
class ExprTest {

    @Test
    void node_withKnownHead_exposesKind() {
        Node node = Node.of(NodeKind.CALL, Expr.symbol("f"), Expr.integer(1));

        assertThat(node.head()).isEqualTo("call");
        assertThat(node.kind()).contains(NodeKind.CALL);
        assertThat(node.is(NodeKind.CALL)).isTrue();
        assertThat(node.size()).isEqualTo(2);
        assertThat(node.child(0)).isEqualTo(Expr.symbol("f"));
    }

    @Test
    void node_withUnknownHead_isRepresentable() {
        Node node = Node.of("weird", Expr.integer(1));

        assertThat(node.kind()).isEmpty();
        assertThat(node.children()).containsExactly(Expr.integer(1));
    }

    @Test
    void node_copiesChildren() {
        List<Expr> children = new ArrayList<>(List.of(Expr.symbol("a")));
        Node node = new Node("tuple", children);

        children.add(Expr.symbol("b"));

        assertThat(node.children()).containsExactly(Expr.symbol("a"));
    }

    @Test
    void childrenFrom_pastEnd_returnsEmpty() {
        Node node = Node.of(NodeKind.CALL, Expr.symbol("f"));

        assertThat(node.childrenFrom(1)).isEmpty();
        assertThat(node.childrenFrom(0)).containsExactly(Expr.symbol("f"));
    }

    @Test
    void records_haveValueEquality() {
        assertThat(Expr.tuple(Expr.integer(1), Expr.integer(2)))
            .isEqualTo(Expr.tuple(Expr.integer(1), Expr.integer(2)));
        assertThat(Expr.pair(Expr.symbol("a"), Expr.nil()))
            .isEqualTo(new Pair(new Symbol("a"), Expr.nil()));
        assertThat(Expr.bool(true)).isSameAs(BooleanAtom.TRUE);
    }

    @Test
    void node_accept_dispatchesToVisitNodeWithLevel() {
        RecordingVisitor visitor = new RecordingVisitor();

        assertThat(Node.of(NodeKind.CALL, Expr.symbol("f")).accept(visitor, 3)).isEqualTo("visitNode@3");
        assertThat(Node.of("weird").accept(visitor, 0)).isEqualTo("visitNode@0");
    }

    @Test
    void accept_dispatchesEachVariantToItsOwnMethod() {
        RecordingVisitor visitor = new RecordingVisitor();

        assertThat(Expr.nil().accept(visitor, 1)).isEqualTo("visitNil@1");
        assertThat(Expr.bool(false).accept(visitor, 1)).isEqualTo("visitBoolean@1");
        assertThat(Expr.symbol("x").accept(visitor, 1)).isEqualTo("visitSymbol@1");
        assertThat(Expr.quoted(Expr.symbol("x")).accept(visitor, 1)).isEqualTo("visitQuotedReference@1");
        assertThat(Expr.tuple().accept(visitor, 1)).isEqualTo("visitTuple@1");
        assertThat(Expr.pair(Expr.symbol("a"), Expr.nil()).accept(visitor, 1)).isEqualTo("visitPair@1");
    }

    @Test
    void unsignedInteger_negative_throwsException() {
        assertThatThrownBy(() -> new UnsignedInteger(BigInteger.valueOf(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void symbol_empty_throwsException() {
        assertThatThrownBy(() -> new Symbol(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void character_invalidCodePoint_throwsException() {
        assertThatThrownBy(() -> new CharacterAtom(-5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void character_supplementaryCodePoint_keepsFullCharacter() {
        CharacterAtom character = new CharacterAtom(0x1F600);

        assertThat(character.text()).hasSize(2);
        assertThat(character.text().codePointAt(0)).isEqualTo(0x1F600);
    }

    @Test
    void nullComponents_throwNullPointerException() {
        assertThatThrownBy(() -> new Node(null, List.of())).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new StringAtom(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new QuotedReference(null)).isInstanceOf(NullPointerException.class);
    }
}
