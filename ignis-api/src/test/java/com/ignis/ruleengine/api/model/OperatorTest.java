package com.ignis.ruleengine.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorTest {

    @ParameterizedTest(name = "[{index}] {0} -> {1}")
    @CsvSource({
            ">, GREATER_THAN",
            "<, LESS_THAN",
            ">=, GREATER_THAN_OR_EQUAL",
            "<=, LESS_THAN_OR_EQUAL",
            "==, EQUAL_TO",
            "!=, NOT_EQUAL_TO"
    })
    @DisplayName("Should resolve every supported symbol")
    void shouldResolveSymbols(String symbol, Operator expected) {
        assertThat(Operator.fromSymbol(symbol)).isEqualTo(expected);
        assertThat(expected.symbol()).isEqualTo(symbol);
    }

    @Test
    @DisplayName("Should return null for unknown symbols")
    void shouldRejectUnknownSymbols() {
        assertThat(Operator.fromSymbol("=>")).isNull();
        assertThat(Operator.fromSymbol("EQUAL_TO")).isNull();
        assertThat(Operator.fromSymbol("")).isNull();
        assertThat(Operator.fromSymbol(null)).isNull();
    }

    @Test
    @DisplayName("Ordering operators compare numbers across numeric types")
    void orderingAcrossNumericTypes() {
        assertThat(Operator.GREATER_THAN.test(42, 40, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.GREATER_THAN.test(40.5, 40, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.LESS_THAN.test(18L, 20.0, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.GREATER_THAN_OR_EQUAL.test(40, 40.0, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.LESS_THAN_OR_EQUAL.test(new BigDecimal("20.0"), 20, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.GREATER_THAN.test(40, 40, ValueKind.NUMERIC)).isFalse();
    }

    @Test
    @DisplayName("Large longs compare exactly against doubles")
    void largeLongAgainstDouble() {
        long aboveTwoTo53 = 9_007_199_254_740_993L;
        double twoTo53 = 9_007_199_254_740_992.0;

        assertThat(Operator.EQUAL_TO.test(aboveTwoTo53, twoTo53, ValueKind.NUMERIC)).isFalse();
        assertThat(Operator.NOT_EQUAL_TO.test(aboveTwoTo53, twoTo53, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.GREATER_THAN.test(aboveTwoTo53, twoTo53, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.LESS_THAN.test(twoTo53, aboveTwoTo53, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.EQUAL_TO.test(9_007_199_254_740_992L, twoTo53, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.LESS_THAN.test(Long.MAX_VALUE, Double.POSITIVE_INFINITY, ValueKind.NUMERIC)).isTrue();
    }

    @Test
    @DisplayName("Equality compares numbers by value and strings exactly")
    void equalitySemantics() {
        assertThat(Operator.EQUAL_TO.test(42, 42.0, ValueKind.NUMERIC)).isTrue();
        assertThat(Operator.NOT_EQUAL_TO.test(42, 42.0, ValueKind.NUMERIC)).isFalse();
        assertThat(Operator.EQUAL_TO.test("raio_seco", "raio_seco", ValueKind.STRING)).isTrue();
        assertThat(Operator.EQUAL_TO.test("RAIO_SECO", "raio_seco", ValueKind.STRING)).isFalse();
        assertThat(Operator.NOT_EQUAL_TO.test("nenhum", "raio_seco", ValueKind.STRING)).isTrue();
    }

    @Test
    @DisplayName("Kind mismatch fails the comparison instead of throwing")
    void kindMismatchFails() {
        assertThat(Operator.GREATER_THAN.test("hot", 40, ValueKind.NUMERIC)).isFalse();
        assertThat(Operator.GREATER_THAN.test(42, "40", ValueKind.STRING)).isFalse();
        assertThat(Operator.EQUAL_TO.test(42, "42", ValueKind.STRING)).isFalse();
        assertThat(Operator.NOT_EQUAL_TO.test(42, "42", ValueKind.STRING)).isFalse();
        assertThat(Operator.EQUAL_TO.test(null, 42, ValueKind.NUMERIC)).isFalse();
    }

    @Test
    @DisplayName("NaN never satisfies a numeric comparison")
    void nanNeverMatches() {
        for (Operator op : Operator.values()) {
            assertThat(op.test(Double.NaN, 1, ValueKind.NUMERIC)).as(op.name()).isFalse();
        }
    }

    @Test
    void isOrdering() {
        assertThat(Operator.GREATER_THAN.isOrdering()).isTrue();
        assertThat(Operator.LESS_THAN_OR_EQUAL.isOrdering()).isTrue();
        assertThat(Operator.EQUAL_TO.isOrdering()).isFalse();
        assertThat(Operator.NOT_EQUAL_TO.isOrdering()).isFalse();
    }
}
