package com.exportscan.service.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class QuantitiesTest {

    @Test
    @DisplayName("Should parse numbers with thousands separators")
    void shouldParseNumbers() {
        assertThat(Quantities.parse("1,200")).isEqualByComparingTo("1200");
        assertThat(Quantities.parse(" 42.50 ")).isEqualByComparingTo("42.5");
    }

    @Test
    @DisplayName("Should treat blank and unparseable cells as absent")
    void shouldTreatGarbageAsAbsent() {
        assertThat(Quantities.parse(null)).isNull();
        assertThat(Quantities.parse("   ")).isNull();
        assertThat(Quantities.parse("NaN")).isNull();
        assertThat(Quantities.parse("n/a")).isNull();
    }

    @Test
    @DisplayName("Should consider null and zero absent")
    void shouldDetectAbsent() {
        assertThat(Quantities.isAbsent(null)).isTrue();
        assertThat(Quantities.isAbsent(new BigDecimal("0.00"))).isTrue();
        assertThat(Quantities.isAbsent(BigDecimal.ONE)).isFalse();
        assertThat(Quantities.orZero(null)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should read the comma as decimal point in semicolon-separated files")
    void shouldParseDecimalComma() {
        assertThat(Quantities.parse("12,5", true)).isEqualByComparingTo("12.5");
        assertThat(Quantities.parse("1.234,50", true)).isEqualByComparingTo("1234.5");
        assertThat(Quantities.parse("1.200", true)).isEqualByComparingTo("1200");
        assertThat(Quantities.parse("7.5", true)).isEqualByComparingTo("7.5");
        assertThat(Quantities.parse("1,2,3", true)).isNull();
    }

    @Test
    @DisplayName("Should read a lone comma that is not a thousands grouping as decimal point")
    void shouldParseLoneDecimalComma() {
        assertThat(Quantities.parse("12,5")).isEqualByComparingTo("12.5");
        assertThat(Quantities.parse("1,200")).isEqualByComparingTo("1200");
        assertThat(Quantities.parse("1,200.75")).isEqualByComparingTo("1200.75");
        assertThat(Quantities.parse("1,2,3")).isNull();
    }
}
