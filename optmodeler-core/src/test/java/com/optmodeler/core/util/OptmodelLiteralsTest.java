package com.optmodeler.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OptmodelLiterals}.
 */
class OptmodelLiteralsTest {

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "-0.0, 0",
        "10, 10",
        "-3, -3",
        "2.5, 2.5",
        "0.1, 0.1",
        "1e20, 1.0E20",
        "1e-9, 1.0E-9"
    })
    void formatNumber_usesStableDecimalForm(double value, String expected) {
        assertThat(OptmodelLiterals.formatNumber(value, 12)).isEqualTo(expected);
    }

    @Test
    void formatNumber_roundsToMaxDigits() {
        assertThat(OptmodelLiterals.formatNumber(1.0 / 3.0, 4)).isEqualTo("0.3333");
        assertThat(OptmodelLiterals.formatNumber(2.00004, 4)).isEqualTo("2");
        assertThat(OptmodelLiterals.formatNumber(0.1 + 0.2, 12)).isEqualTo("0.3");
    }

    @Test
    void formatNumber_infinity_usesBigConstant() {
        assertThat(OptmodelLiterals.formatNumber(Double.POSITIVE_INFINITY)).isEqualTo("constant('BIG')");
        assertThat(OptmodelLiterals.formatNumber(Double.NEGATIVE_INFINITY)).isEqualTo("-constant('BIG')");
    }

    @Test
    void formatNumber_nan_throwsException() {
        assertThatThrownBy(() -> OptmodelLiterals.formatNumber(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quote_doublesEmbeddedQuotes() {
        assertThat(OptmodelLiterals.quote("O'Hare")).isEqualTo("'O''Hare'");
    }

    @Test
    void formatElement_handlesStringsAndNumbers() {
        assertThat(OptmodelLiterals.formatElement("a", 12)).isEqualTo("'a'");
        assertThat(OptmodelLiterals.formatElement(7L, 12)).isEqualTo("7");
        assertThat(OptmodelLiterals.formatElement(1.25, 12)).isEqualTo("1.25");
        assertThatThrownBy(() -> OptmodelLiterals.formatElement(new Object(), 12))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
