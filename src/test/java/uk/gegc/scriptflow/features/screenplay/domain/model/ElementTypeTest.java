package uk.gegc.scriptflow.features.screenplay.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.scriptflow.shared.exception.InvalidGroupException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"scene_heading", "SCENE_HEADING", " scene-heading ", "Scene Heading"})
    @DisplayName("fromValue accepts the wire value in any common spelling")
    void fromValue_acceptsVariants(String raw) {
        assertThat(ElementType.fromValue(raw)).isEqualTo(ElementType.SCENE_HEADING);
    }

    @Test
    @DisplayName("fromValue rejects unknown and missing types")
    void fromValue_rejectsUnknown() {
        assertThatThrownBy(() -> ElementType.fromValue("montage"))
                .isInstanceOf(InvalidGroupException.class)
                .hasMessageContaining("montage");
        assertThatThrownBy(() -> ElementType.fromValue(" "))
                .isInstanceOf(InvalidGroupException.class);
    }

    @Test
    @DisplayName("Only writer-only kinds are non-mappeable")
    void nonMappeableKinds() {
        assertThat(ElementType.values())
                .filteredOn(ElementType::isNonMappeable)
                .containsExactlyInAnyOrder(ElementType.NOTE, ElementType.SECTION, ElementType.PAGE_BREAK, ElementType.TITLE_PAGE);
    }
}
