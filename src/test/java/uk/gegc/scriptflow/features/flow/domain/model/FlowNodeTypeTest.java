package uk.gegc.scriptflow.features.flow.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.scriptflow.shared.exception.InvalidNodeTypeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowNodeTypeTest {

    @Test
    @DisplayName("fromValue is case-insensitive")
    void fromValue_caseInsensitive() {
        assertThat(FlowNodeType.fromValue("Dialogue")).isEqualTo(FlowNodeType.DIALOGUE);
        assertThat(FlowNodeType.fromValue("subflow")).isEqualTo(FlowNodeType.SUBFLOW);
    }

    @Test
    @DisplayName("fromValue rejects unknown node types")
    void fromValue_rejectsUnknown() {
        assertThatThrownBy(() -> FlowNodeType.fromValue("teleport"))
                .isInstanceOf(InvalidNodeTypeException.class)
                .hasMessageContaining("teleport");
        assertThatThrownBy(() -> FlowNodeType.fromValue(null))
                .isInstanceOf(InvalidNodeTypeException.class);
    }

    @Test
    @DisplayName("Node source defaults to manual")
    void nodeSourceDefaultsToManual() {
        assertThat(NodeSource.fromValue(null)).isEqualTo(NodeSource.MANUAL);
        assertThat(NodeSource.fromValue("SCREENPLAY_SYNC")).isEqualTo(NodeSource.SCREENPLAY_SYNC);
        assertThatThrownBy(() -> NodeSource.fromValue("imported"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
