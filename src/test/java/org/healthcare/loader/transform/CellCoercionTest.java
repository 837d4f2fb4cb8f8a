package org.healthcare.loader.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CellCoercion Unit Tests")
class CellCoercionTest {

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        @DisplayName("Should trim surrounding whitespace")
        void shouldTrim() {
            assertThat(CellCoercion.coerceString("  Dr. X \t")).contains("Dr. X");
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("Should treat missing and blank cells as absent")
        void shouldTreatBlankAsAbsent(String value) {
            assertThat(CellCoercion.coerceString(value)).isEmpty();
        }

        @Test
        @DisplayName("Should render numeric cells as text")
        void shouldRenderNumbers() {
            assertThat(CellCoercion.coerceString(101)).contains("101");
            assertThat(CellCoercion.coerceString(Double.NaN)).isEmpty();
        }

        @ParameterizedTest
        @ValueSource(strings = {"NA", "N/A", "n/a", "NULL", "null", "NaN", "nan", "#N/A", "<NA>", "None", " NA "})
        @DisplayName("Should treat missing-value markers as absent")
        void shouldTreatMissingMarkersAsAbsent(String value) {
            assertThat(CellCoercion.coerceString(value)).isEmpty();
            assertThat(CellCoercion.normalizeLower(value)).isEmpty();
            assertThat(CellCoercion.coerceInt(value)).isEmpty();
            assertThat(CellCoercion.coerceFloat(value)).isEmpty();
            assertThat(CellCoercion.coerceDate(value)).isEmpty();
        }

        @Test
        @DisplayName("Should keep text that merely contains a marker")
        void shouldKeepTextContainingMarker() {
            assertThat(CellCoercion.coerceString("Nancy")).contains("Nancy");
            assertThat(CellCoercion.coerceString("NA Clinic")).contains("NA Clinic");
        }

        @Test
        @DisplayName("Should lower-case and keep absence")
        void shouldNormalizeLower() {
            assertThat(CellCoercion.normalizeLower(" St. MARY ")).contains("st. mary");
            assertThat(CellCoercion.normalizeLower("  ")).isEmpty();
            assertThat(CellCoercion.normalizeLower(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Integers")
    class Integers {

        @Test
        @DisplayName("Should parse plain and float-looking integers")
        void shouldParse() {
            assertThat(CellCoercion.coerceInt("34")).contains(34);
            assertThat(CellCoercion.coerceInt("42.0")).contains(42);
            assertThat(CellCoercion.coerceInt(" 42.9 ")).contains(42);
            assertThat(CellCoercion.coerceInt("-7.5")).contains(-7);
            assertThat(CellCoercion.coerceInt(57L)).contains(57);
            assertThat(CellCoercion.coerceInt(12.75d)).contains(12);
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "abc", "34 years", "1,000", "99999999999"})
        @DisplayName("Should yield absent on malformed input")
        void shouldRejectMalformed(String value) {
            assertThat(CellCoercion.coerceInt(value)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Floats")
    class Floats {

        @Test
        @DisplayName("Should strip thousands separators")
        void shouldStripCommas() {
            assertThat(CellCoercion.coerceFloat("1,200.50")).contains(1200.50);
            assertThat(CellCoercion.coerceFloat("1,234,567")).contains(1234567.0);
        }

        @Test
        @DisplayName("Should accept numeric cells")
        void shouldAcceptNumbers() {
            assertThat(CellCoercion.coerceFloat(18856.281305978155)).contains(18856.281305978155);
            assertThat(CellCoercion.coerceFloat(new BigDecimal("10.25"))).contains(10.25);
            assertThat(CellCoercion.coerceFloat("-502.5")).contains(-502.5);
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "n/a", "$100", "12.5.3"})
        @DisplayName("Should yield absent on malformed input")
        void shouldRejectMalformed(String value) {
            assertThat(CellCoercion.coerceFloat(value)).isEmpty();
        }

        @Test
        @DisplayName("Should reject non-finite numbers")
        void shouldRejectNonFinite() {
            assertThat(CellCoercion.coerceFloat(Double.NaN)).isEmpty();
            assertThat(CellCoercion.coerceFloat(Double.POSITIVE_INFINITY)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        @Test
        @DisplayName("Should resolve ambiguous dates day-first")
        void shouldParseDayFirst() {
            assertThat(CellCoercion.coerceDate("05/11/2023")).contains(LocalDate.of(2023, 11, 5));
            assertThat(CellCoercion.coerceDate("03/04/2021")).contains(LocalDate.of(2021, 4, 3));
            assertThat(CellCoercion.coerceDate("3-4-2021")).contains(LocalDate.of(2021, 4, 3));
            assertThat(CellCoercion.coerceDate("03.04.2021")).contains(LocalDate.of(2021, 4, 3));
        }

        @Test
        @DisplayName("Should fall back to month-first when day-first is impossible")
        void shouldFallBackToMonthFirst() {
            assertThat(CellCoercion.coerceDate("03/25/2023")).contains(LocalDate.of(2023, 3, 25));
            assertThat(CellCoercion.coerceDate("12/31/2022")).contains(LocalDate.of(2022, 12, 31));
            assertThat(CellCoercion.coerceDate("12-31-2022 14:05")).contains(LocalDate.of(2022, 12, 31));
        }

        @Test
        @DisplayName("Should accept two-digit years")
        void shouldParseTwoDigitYears() {
            assertThat(CellCoercion.coerceDate("05/11/23")).contains(LocalDate.of(2023, 11, 5));
            assertThat(CellCoercion.coerceDate("5.11.23")).contains(LocalDate.of(2023, 11, 5));
            assertThat(CellCoercion.coerceDate("12/31/22")).contains(LocalDate.of(2022, 12, 31));
        }

        @Test
        @DisplayName("Should read unambiguous day-first dates whose day exceeds 12")
        void shouldParseLargeDay() {
            assertThat(CellCoercion.coerceDate("31/01/2024")).contains(LocalDate.of(2024, 1, 31));
        }

        @Test
        @DisplayName("Should parse ISO dates year-first")
        void shouldParseIso() {
            assertThat(CellCoercion.coerceDate("2024-01-31")).contains(LocalDate.of(2024, 1, 31));
            assertThat(CellCoercion.coerceDate("2022-02-01")).contains(LocalDate.of(2022, 2, 1));
            assertThat(CellCoercion.coerceDate("2024/1/5")).contains(LocalDate.of(2024, 1, 5));
        }

        @Test
        @DisplayName("Should drop time of day and offset")
        void shouldTruncateTime() {
            assertThat(CellCoercion.coerceDate("2022-02-01T23:15:00+05:00")).contains(LocalDate.of(2022, 2, 1));
            assertThat(CellCoercion.coerceDate("2022-02-01 23:15:00")).contains(LocalDate.of(2022, 2, 1));
            assertThat(CellCoercion.coerceDate("01/02/2022 08:30")).contains(LocalDate.of(2022, 2, 1));
            assertThat(CellCoercion.coerceDate(LocalDateTime.of(2022, 2, 1, 13, 45))).contains(LocalDate.of(2022, 2, 1));
            assertThat(CellCoercion.coerceDate(OffsetDateTime.of(2022, 2, 1, 13, 45, 0, 0, ZoneOffset.ofHours(-8))))
                .contains(LocalDate.of(2022, 2, 1));
        }

        @Test
        @DisplayName("Should parse month names")
        void shouldParseMonthNames() {
            assertThat(CellCoercion.coerceDate("5 Nov 2023")).contains(LocalDate.of(2023, 11, 5));
            assertThat(CellCoercion.coerceDate("November 5, 2023")).contains(LocalDate.of(2023, 11, 5));
        }

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "yesterday", "31/02/2023", "2023-13-01", "13/13/2013"})
        @DisplayName("Should yield absent on unparseable dates")
        void shouldRejectMalformed(String value) {
            assertThat(CellCoercion.coerceDate(value)).isEmpty();
        }
    }
}
