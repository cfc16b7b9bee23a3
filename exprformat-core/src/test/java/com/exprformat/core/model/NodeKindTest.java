package com.exprformat.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeKind}.
 */
class NodeKindTest {

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void fromHead_ownHead_returnsKind(NodeKind kind) {
        assertThat(NodeKind.fromHead(kind.head())).contains(kind);
    }

    @Test
    void fromHead_unknownHead_returnsEmpty() {
        assertThat(NodeKind.fromHead("weird")).isEmpty();
        assertThat(NodeKind.fromHead("")).isEmpty();
    }

    @Test
    void heads_areUnique() {
        assertThat(Arrays.stream(NodeKind.values()).map(NodeKind::head))
            .doesNotHaveDuplicates();
    }

    @Test
    void acceptsArity_conditional_allowsTwoOrThreeChildren() {
        assertThat(NodeKind.CONDITIONAL.acceptsArity(1)).isFalse();
        assertThat(NodeKind.CONDITIONAL.acceptsArity(2)).isTrue();
        assertThat(NodeKind.CONDITIONAL.acceptsArity(3)).isTrue();
        assertThat(NodeKind.CONDITIONAL.acceptsArity(4)).isFalse();
    }

    @Test
    void acceptsArity_variadicKinds_acceptManyChildren() {
        assertThat(NodeKind.TUPLE.acceptsArity(0)).isTrue();
        assertThat(NodeKind.TUPLE.acceptsArity(1000)).isTrue();
        assertThat(NodeKind.CALL.acceptsArity(0)).isFalse();
        assertThat(NodeKind.CALL.acceptsArity(1)).isTrue();
    }
}
