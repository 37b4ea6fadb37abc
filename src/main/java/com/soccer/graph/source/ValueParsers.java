package com.soccer.graph.source;

import java.math.BigDecimal;
import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String to value coercions shared by the adapters. Every failure is a {@link RowParseException}.
 */
public final class ValueParsers {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            strict("uuuu-MM-dd HH:mm:ss", Locale.ROOT),
            strict("uuuu-MM-dd HH:mm", Locale.ROOT),
            strict("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT),
            strict("uuuu-MM-dd'T'HH:mm", Locale.ROOT),
            strict("dd/MM/uuuu HH:mm:ss", Locale.ROOT),
            strict("dd/MM/uuuu HH:mm", Locale.ROOT));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-MM-dd", Locale.ROOT),
            strict("dd/MM/uuuu", Locale.ROOT),
            strict("dd-MM-uuuu", Locale.ROOT),
            strict("uuuu/MM/dd", Locale.ROOT),
            strict("MMM d, uuuu", Locale.ENGLISH));

    private static final Pattern GROUPED_COUNT = Pattern.compile("\\d{1,3}([.,]\\d{3})+");
    private static final Pattern MONEY = Pattern.compile("^(?:R\\$|[€$£])?\\s*(\\d+(?:\\.\\d+)?)\\s*([KkMm]?)$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");

    private ValueParsers() {
        // Utility class
    }

    private static DateTimeFormatter strict(String pattern, Locale locale) {
        return DateTimeFormatter.ofPattern(pattern, locale).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses an integer. Accepts a zero fraction ({@code "2.0"}), as spreadsheet exports write.
     */
    public static int parseInt(String field, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(value.trim()).intValueExact();
            } catch (NumberFormatException | ArithmeticException e2) {
                throw new RowParseException(field, value, "integer", e2);
            }
        }
    }

    public static Integer parseOptionalInt(String field, String value) {
        return value == null ? null : parseInt(field, value);
    }

    public static long parseLong(String field, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(value.trim()).longValueExact();
            } catch (NumberFormatException | ArithmeticException e2) {
                throw new RowParseException(field, value, "integer", e2);
            }
        }
    }

    /**
     * Parses a count that may use thousands separators, e.g. {@code 78.838} or {@code 78,838}.
     */
    public static Integer parseOptionalCount(String field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (GROUPED_COUNT.matcher(trimmed).matches()) {
            trimmed = trimmed.replace(".", "").replace(",", "");
        }
        return parseInt(field, trimmed);
    }

    /**
     * Parses a money amount such as {@code €565K}, {@code €1.5M} or {@code 2000}.
     */
    public static Integer parseOptionalMoney(String field, String value) {
        if (value == null) {
            return null;
        }
        Matcher m = MONEY.matcher(value.trim());
        if (!m.matches()) {
            throw new RowParseException(field, value, "money amount");
        }
        BigDecimal amount = new BigDecimal(m.group(1));
        String unit = m.group(2).toUpperCase(Locale.ROOT);
        if (unit.equals("K")) {
            amount = amount.multiply(BigDecimal.valueOf(1_000));
        } else if (unit.equals("M")) {
            amount = amount.multiply(BigDecimal.valueOf(1_000_000));
        }
        try {
            return amount.intValueExact();
        } catch (ArithmeticException e) {
            throw new RowParseException(field, value, "money amount", e);
        }
    }

    /**
     * Parses a date-time; a date-only value starts at 00:00.
     */
    public static LocalDateTime parseDateTime(String field, String value) {
        String trimmed = value.trim();
        LocalDateTime dateTime = firstMatch(DATE_TIME_FORMATS, field, trimmed, LocalDateTime::from);
        return dateTime != null ? dateTime : parseDate(field, trimmed).atStartOfDay();
    }

    public static LocalDate parseDate(String field, String value) {
        String trimmed = value.trim();
        LocalDate date = firstMatch(DATE_FORMATS, field, trimmed, LocalDate::from);
        if (date == null) {
            throw new RowParseException(field, value, "date");
        }
        return date;
    }

    /**
     * Parses with the first format whose pattern covers the whole text, or returns null
     * when none does. A text that fits a pattern but names an impossible date fails.
     */
    private static <T> T firstMatch(List<DateTimeFormatter> formats, String field, String text,
                                    TemporalQuery<T> query) {
        for (DateTimeFormatter format : formats) {
            ParsePosition position = new ParsePosition(0);
            if (format.parseUnresolved(text, position) != null
                    && position.getErrorIndex() < 0 && position.getIndex() == text.length()) {
                try {
                    return format.parse(text, query);
                } catch (DateTimeParseException e) {
                    throw new RowParseException(field, text, "date", e);
                }
            }
        }
        return null;
    }

    public static LocalDate parseOptionalDate(String field, String value) {
        return value == null ? null : parseDate(field, value);
    }

    /**
     * Parses a year given either as {@code 2021} or as a full date.
     */
    public static Integer parseOptionalYear(String field, String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (YEAR.matcher(trimmed).matches()) {
            return Integer.parseInt(trimmed);
        }
        return parseDate(field, trimmed).getYear();
    }
}
