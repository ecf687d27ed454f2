package com.optmodeler.core.expression;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IndexKey}.
 */
class IndexKeyTest {

    @Test
    void of_flattensTuples() {
        IndexKey key = IndexKey.of(List.of("a", 1), 2);

        assertThat(key.elements()).containsExactly("a", 1L, 2L);
        assertThat(key.arity()).isEqualTo(3);
    }

    @Test
    void of_integralDouble_normalizesToLong() {
        assertThat(IndexKey.of(3.0)).isEqualTo(IndexKey.of(3));
        assertThat(IndexKey.of(2.5).get(0)).isEqualTo(2.5);
    }

    @Test
    void of_nullElement_throwsException() {
        assertThatThrownBy(() -> IndexKey.of("a", null)).isInstanceOf(RuntimeException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "'*', 1, true",
        "a, '*', true",
        "a, 1, true",
        "b, 1, false",
        "a, 2, false"
    })
    void matches_wildcardPattern(String first, String second, boolean expected) {
        IndexKey key = IndexKey.of("a", 1);
        Object secondElement = "*".equals(second) ? second : Long.parseLong(second);

        assertThat(key.matches(IndexKey.of(first, secondElement))).isEqualTo(expected);
    }

    @Test
    void isSymbolic_withExpression_returnsTrue() {
        assertThat(IndexKey.of(Expressions.constant(1)).isSymbolic()).isTrue();
        assertThat(IndexKey.of("a").isSymbolic()).isFalse();
    }
}
