package taskapp.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Stateless field checks shared by the domain objects and the services.
 *
 * <p>Nothing here touches the datastore. Checks that need to read Users or
 * Tasks live in {@link taskapp.service.ValidationService}.
 *
 * <h2>Timestamps</h2>
 * <p>{@link #parseTimestamp(Object)} accepts:
 * <ul>
 *   <li>numbers, read as epoch milliseconds (fraction dropped) within
 *       &plusmn;{@value #MAX_EPOCH_MILLIS}</li>
 *   <li>ISO-8601 instants and offset/zoned date-times</li>
 *   <li>ISO-8601 local date-times and {@code yyyy-MM-dd HH:mm[:ss]}, read as UTC</li>
 *   <li>ISO-8601 dates, read as UTC midnight</li>
 *   <li>RFC-1123 strings such as {@code Tue, 3 Jun 2008 11:05:30 GMT}</li>
 * </ul>
 */
public final class Validation {

    /** Largest distance from the epoch, in milliseconds, that a timestamp may have: 100,000,000 days. */
    static final long MAX_EPOCH_MILLIS = 8_640_000_000_000_000L;

    private static final BigDecimal MAX_EPOCH_MILLIS_DECIMAL = BigDecimal.valueOf(MAX_EPOCH_MILLIS);
    private static final Instant EARLIEST = Instant.ofEpochMilli(-MAX_EPOCH_MILLIS);
    private static final Instant LATEST = Instant.ofEpochMilli(MAX_EPOCH_MILLIS);

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private static final Pattern IDENTIFIER = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant(),
            value -> LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

    private Validation() {
    }

    /**
     * Trims and returns {@code value}.
     *
     * @param value raw input
     * @param label field name used in the error message
     * @return trimmed value
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String validateNotBlank(final String value, final String label) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(label + " must not be null or blank");
        }
        return value.trim();
    }

    public static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    /**
     * Syntactic email check: one {@code @}, no whitespace, and a dot in the domain part.
     * No DNS or deliverability check is made.
     */
    public static boolean isValidEmail(final String email) {
        return email != null && EMAIL.matcher(email).matches();
    }

    /**
     * @return {@code true} if {@code id} is a canonical UUID string
     */
    public static boolean isValidIdentifier(final String id) {
        return id != null && IDENTIFIER.matcher(id).matches();
    }

    public static boolean isValidDate(final Object value) {
        return parseTimestamp(value).isPresent();
    }

    /**
     * Parses any supported timestamp representation. Past and future values are both accepted
     * as long as they lie within &plusmn;{@value #MAX_EPOCH_MILLIS} ms of the epoch.
     *
     * @param value number, string, {@link Instant} or {@link Date}
     * @return the instant, or empty if the value cannot be read as one or is out of range
     */
    public static Optional<Instant> parseTimestamp(final Object value) {
        return read(value).filter(instant -> !instant.isBefore(EARLIEST) && !instant.isAfter(LATEST));
    }

    private static Optional<Instant> read(final Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            return epochMillis(number).map(Instant::ofEpochMilli);
        }
        if (value instanceof CharSequence text) {
            return parseText(text.toString().trim());
        }
        return Optional.empty();
    }

    private static Optional<Long> epochMillis(final Number number) {
        final BigDecimal exact;
        if (number instanceof BigDecimal decimal) {
            exact = decimal;
        } else if (number instanceof BigInteger integer) {
            exact = new BigDecimal(integer);
        } else if (number instanceof Double || number instanceof Float) {
            final double millis = number.doubleValue();
            if (Double.isNaN(millis) || Double.isInfinite(millis)) {
                return Optional.empty();
            }
            exact = BigDecimal.valueOf(millis);
        } else {
            exact = BigDecimal.valueOf(number.longValue());
        }
        if (exact.abs().compareTo(MAX_EPOCH_MILLIS_DECIMAL) > 0) {
            return Optional.empty();
        }
        return Optional.of(exact.longValue());
    }

    private static Optional<Instant> parseText(final String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return Optional.of(parser.apply(text));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }
}
