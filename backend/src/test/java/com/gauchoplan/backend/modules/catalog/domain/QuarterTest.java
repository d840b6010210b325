package com.gauchoplan.backend.modules.catalog.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QuarterTest {

    @Test
    @DisplayName("quarter input is trimmed and matched case-insensitively")
    void parse() {
        assertThat(Quarter.parse("Winter")).isEqualTo(Quarter.WINTER);
        assertThat(Quarter.parse("  spring ")).isEqualTo(Quarter.SPRING);
        assertThat(Quarter.parse("SUMMER")).isEqualTo(Quarter.SUMMER);
        assertThat(Quarter.parse("fall")).isEqualTo(Quarter.FALL);
    }

    @Test
    void parse_rejectsUnknownOrBlank() {
        assertThatThrownBy(() -> Quarter.parse("Autumn")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Quarter.parse(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Quarter.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void converterStoresTitleCase() {
        QuarterConverter converter = new QuarterConverter();

        assertThat(converter.convertToDatabaseColumn(Quarter.WINTER)).isEqualTo("Winter");
        assertThat(converter.convertToEntityAttribute("Fall")).isEqualTo(Quarter.FALL);
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void converterReadsQuarterNamesWithSuffix() {
        QuarterConverter converter = new QuarterConverter();

        assertThat(converter.convertToEntityAttribute("Fall Quarter")).isEqualTo(Quarter.FALL);
        assertThat(converter.convertToEntityAttribute(" WINTER 2026")).isEqualTo(Quarter.WINTER);
        assertThatThrownBy(() -> converter.convertToEntityAttribute("Autumn Quarter"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Autumn Quarter");
    }

    @Test
    void parseStaysStrictForInput() {
        assertThatThrownBy(() -> Quarter.parse("Fall Quarter"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
