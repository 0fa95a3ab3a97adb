package uk.gegc.scriptflow.shared.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.scriptflow.testsupport.ScreenplayFixtures.json;

class JsonNodeConverterTest {

    private final JsonNodeConverter converter = new JsonNodeConverter();

    @Test
    @DisplayName("Absent payloads are stored as SQL null")
    void absentPayloadIsNull() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToDatabaseColumn(NullNode.getInstance())).isNull();
        assertThat(converter.convertToDatabaseColumn(MissingNode.getInstance())).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
        assertThat(converter.convertToEntityAttribute("  ")).isNull();
    }

    @Test
    @DisplayName("Object payloads are stored as compact JSON and read back")
    void objectPayload() {
        String stored = converter.convertToDatabaseColumn(json("{'sheet_id': 'abc', 'n': 2}"));

        assertThat(stored).isEqualTo("{\"sheet_id\":\"abc\",\"n\":2}");
        JsonNode restored = converter.convertToEntityAttribute(stored);
        assertThat(restored.get("sheet_id").asText()).isEqualTo("abc");
        assertThat(restored.get("n").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Unreadable column text is reported")
    void unreadableColumn() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{broken"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deserialize");
    }
}
