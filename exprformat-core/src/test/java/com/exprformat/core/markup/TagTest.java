package com.exprformat.core.markup;

import com.exprformat.core.model.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Tag}.
 */
class TagTest {

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void forKind_everyKind_hasTag(NodeKind kind) {
        assertThat(Tag.forKind(kind)).isNotNull();
    }

    @Test
    void forKind_renamedKinds_useTheirCategory() {
        assertThat(Tag.forKind(NodeKind.CONDITIONAL)).isEqualTo(Tag.IF);
        assertThat(Tag.forKind(NodeKind.LIST)).isEqualTo(Tag.VECT);
        assertThat(Tag.forKind(NodeKind.MAPPING)).isEqualTo(Tag.DICT);
        assertThat(Tag.forKind(NodeKind.INDEXING)).isEqualTo(Tag.REF);
        assertThat(Tag.forKind(NodeKind.USING)).isEqualTo(Tag.IMPORT);
        assertThat(Tag.forKind(NodeKind.AND)).isEqualTo(Tag.LOGICAL);
        assertThat(Tag.forKind(NodeKind.OR)).isEqualTo(Tag.LOGICAL);
        assertThat(Tag.forKind(NodeKind.ASSIGNMENT).selector()).isEqualTo("span.def");
    }

    @Test
    void forCategory_knownCategory_returnsTag() {
        assertThat(Tag.forCategory("hexnumber")).contains(Tag.HEX_NUMBER);
        assertThat(Tag.forCategory("error")).contains(Tag.ERROR);
        assertThat(Tag.forCategory("nope")).isEmpty();
    }

    @Test
    void selectors_areUniqueAndStartWithElement() {
        assertThat(Arrays.stream(Tag.values()).map(Tag::selector)).doesNotHaveDuplicates();
        assertThat(Tag.values()).allSatisfy(tag ->
            assertThat(TagSelector.parse(tag.selector()).element()).isEqualTo("span"));
    }

    @Test
    void selector_constantNumbers_nestClasses() {
        assertThat(TagSelector.parse(Tag.HEX_NUMBER.selector()).classes())
            .containsExactly("constant", "number", "hex");
    }
}
