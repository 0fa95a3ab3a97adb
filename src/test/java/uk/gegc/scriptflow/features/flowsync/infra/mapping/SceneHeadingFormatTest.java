package uk.gegc.scriptflow.features.flowsync.infra.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.SceneHeadingFormat.SceneHeading;

import static org.assertj.core.api.Assertions.assertThat;

class SceneHeadingFormatTest {

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "INT. TAVERN - NIGHT    | int     | TAVERN     | NIGHT",
            "EXT. FOREST - DAY      | ext     | FOREST     | DAY",
            "INT./EXT. CAR - DAWN   | int_ext | CAR        | DAWN",
            "I/E. CAR - DUSK        | int_ext | CAR        | DUSK",
            "int. kitchen           | int     | kitchen    | ''",
            "EXT BEACH - LATER      | ext     | BEACH      | LATER",
            "INT. - DAY             | int     | ''         | DAY",
            "INTERIOR OF A WHALE    | int     | INTERIOR OF A WHALE | ''"
    })
    @DisplayName("parse splits prefix, description and time of day")
    void parse(String content, String intExt, String description, String timeOfDay) {
        SceneHeading heading = SceneHeadingFormat.parse(content);

        assertThat(heading.intExt()).isEqualTo(intExt);
        assertThat(heading.description()).isEqualTo(description);
        assertThat(heading.timeOfDay()).isEqualTo(timeOfDay);
    }

    @Test
    @DisplayName("parse keeps hyphenated location names intact")
    void parse_hyphenatedDescription() {
        SceneHeading heading = SceneHeadingFormat.parse("EXT. TOWN-SQUARE - NOON");

        assertThat(heading.description()).isEqualTo("TOWN-SQUARE");
        assertThat(heading.timeOfDay()).isEqualTo("NOON");
    }

    @Test
    @DisplayName("format omits the time suffix when blank")
    void format_withoutTime() {
        assertThat(SceneHeadingFormat.format("ext", "FOREST", "")).isEqualTo("EXT. FOREST");
        assertThat(SceneHeadingFormat.format("int", "OFFICE", null)).isEqualTo("INT. OFFICE");
    }

    @Test
    @DisplayName("format rebuilds every prefix")
    void format_prefixes() {
        assertThat(SceneHeadingFormat.format("int", "OFFICE", "DAY")).isEqualTo("INT. OFFICE - DAY");
        assertThat(SceneHeadingFormat.format("ext", "ROAD", "NIGHT")).isEqualTo("EXT. ROAD - NIGHT");
        assertThat(SceneHeadingFormat.format("int_ext", "CAR", "DAWN")).isEqualTo("INT./EXT. CAR - DAWN");
        assertThat(SceneHeadingFormat.format(null, "", "DAY")).isEqualTo(SceneHeadingFormat.DEFAULT_HEADING);
    }

    @Test
    @DisplayName("format of a parsed heading reproduces the input")
    void parseThenFormat() {
        SceneHeading heading = SceneHeadingFormat.parse("INT. OFFICE - DAY");

        assertThat(SceneHeadingFormat.format(heading.intExt(), heading.description(), heading.timeOfDay()))
                .isEqualTo("INT. OFFICE - DAY");
    }
}
