package org.healthcare.loader.transform;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Permissive conversions from raw CSV cells to typed values.
 * <p>
 * None of these methods throw on malformed input: a missing, blank or unparseable
 * cell yields {@link Optional#empty()}.
 */
@Slf4j
public final class CellCoercion {

    /**
     * Cell texts read as missing, matching the default NA markers of common CSV exporters.
     */
    private static final Set<String> MISSING_MARKERS = Set.of(
        "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
        "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null"
    );

    /**
     * Two-digit years land within fifty years of now.
     */
    private static final int TWO_DIGIT_YEAR_BASE = Year.now().getValue() - 50;

    /**
     * Tried in order. Ambiguous numeric dates are read day-first; a date that is only
     * valid month-first (e.g. {@code 03/25/2023}) falls through to the month-first formats.
     */
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_DATE_TIME,
        DateTimeFormatter.ISO_DATE,
        strict("uuuu-M-d[ H:mm[:ss]]"),
        strict("uuuu/M/d[ H:mm[:ss]]"),
        numeric('/', true, false),
        numeric('-', true, false),
        numeric('.', true, false),
        numeric('/', true, true),
        numeric('-', true, true),
        numeric('.', true, true),
        numeric('/', false, false),
        numeric('-', false, false),
        numeric('.', false, false),
        numeric('/', false, true),
        numeric('-', false, true),
        numeric('.', false, true),
        strict("d MMM uuuu"),
        strict("d MMMM uuuu"),
        strict("MMM d, uuuu"),
        strict("MMMM d, uuuu")
    );

    private CellCoercion() {
    }

    public static Optional<String> coerceString(Object value) {
        if (isMissing(value)) {
            return Optional.empty();
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    public static Optional<String> normalizeLower(Object value) {
        return coerceString(value).map(s -> s.toLowerCase(Locale.ROOT));
    }

    /**
     * Integer value, truncating float-looking input such as {@code "42.0"} or {@code "42.9"}.
     */
    public static Optional<Integer> coerceInt(Object value) {
        if (value instanceof Integer) {
            return Optional.of((Integer) value);
        }
        return decimal(value, false).flatMap(d -> {
            try {
                return Optional.of(d.toBigInteger().intValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Floating point value; thousands separators ({@code ,}) are ignored.
     */
    public static Optional<Double> coerceFloat(Object value) {
        return decimal(value, true).map(BigDecimal::doubleValue)
            .filter(Double::isFinite);
    }

    /**
     * Calendar date with time-of-day and offset discarded.
     */
    public static Optional<LocalDate> coerceDate(Object value) {
        if (value instanceof LocalDate) {
            return Optional.of((LocalDate) value);
        }
        if (value instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) value).toLocalDate());
        }
        if (value instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) value).toLocalDate());
        }
        if (value instanceof ZonedDateTime) {
            return Optional.of(((ZonedDateTime) value).toLocalDate());
        }
        if (value instanceof Instant) {
            return Optional.of(LocalDate.ofInstant((Instant) value, ZoneOffset.UTC));
        }
        if (value instanceof Date) {
            return Optional.of(LocalDate.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC));
        }
        return coerceString(value).flatMap(CellCoercion::parseDate);
    }

    private static Optional<LocalDate> parseDate(String text) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                TemporalAccessor parsed = format.parse(text);
                LocalDate date = parsed.query(TemporalQueries.localDate());
                if (date != null) {
                    return Optional.of(date);
                }
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", text, format);
            }
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> decimal(Object value, boolean stripGrouping) {
        if (isMissing(value)) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal) {
            return Optional.of((BigDecimal) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        Optional<String> text = coerceString(value);
        if (stripGrouping) {
            text = text.map(s -> s.replace(",", ""));
        }
        return text.flatMap(s -> {
            try {
                return Optional.of(new BigDecimal(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    private static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        if (value instanceof Float) {
            return ((Float) value).isNaN();
        }
        if (value instanceof CharSequence) {
            return MISSING_MARKERS.contains(value.toString().trim());
        }
        return false;
    }

    /**
     * Numeric date with the given separator, day-first or month-first, four- or two-digit year.
     */
    private static DateTimeFormatter numeric(char separator, boolean dayFirst, boolean twoDigitYear) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
            .appendValue(dayFirst ? ChronoField.DAY_OF_MONTH : ChronoField.MONTH_OF_YEAR)
            .appendLiteral(separator)
            .appendValue(dayFirst ? ChronoField.MONTH_OF_YEAR : ChronoField.DAY_OF_MONTH)
            .appendLiteral(separator);
        if (twoDigitYear) {
            builder.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
        } else {
            builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD);
        }
        return builder
            .appendPattern("[ H:mm[:ss]]")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
