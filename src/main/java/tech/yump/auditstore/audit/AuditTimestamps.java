package tech.yump.auditstore.audit;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp conventions shared by the event model, the index keys and the export formats.
 * All instants are UTC with microsecond resolution.
 */
public final class AuditTimestamps {

    private static final long MICROS_PER_SECOND = 1_000_000L;

    // e.g. 2026-10-19T08:15:30.123456+00:00
    private static final DateTimeFormatter ISO_MICROS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    // Instants outside this range have no exact epoch-micros key
    private static final Instant MIN_KEY_INSTANT = fromEpochMicros(Long.MIN_VALUE);
    private static final Instant MAX_KEY_INSTANT = fromEpochMicros(Long.MAX_VALUE);

    private static final DateTimeFormatter FILENAME_STAMP =
            DateTimeFormatter.ofPattern("uuuuMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private AuditTimestamps() {
    }

    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    public static String format(Instant instant) {
        return instant == null ? null : ISO_MICROS.format(instant.atOffset(ZoneOffset.UTC));
    }

    /**
     * Parses an ISO-8601 timestamp with offset (or a trailing {@code Z}).
     *
     * @throws IllegalArgumentException if the text is not a valid timestamp
     */
    public static Instant parse(String text) {
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 timestamp: " + text, e);
        }
    }

    public static String filenameStamp(Instant instant) {
        return FILENAME_STAMP.format(instant);
    }

    /**
     * Epoch microseconds of {@code instant}: the seconds-since-epoch key scaled by 1,000,000.
     */
    public static long toEpochMicros(Instant instant) {
        long seconds = instant.getEpochSecond();
        long micros = instant.getNano() / 1_000L;
        if (seconds < 0 && micros > 0) {
            // Same split as Instant.toEpochMilli, so Long.MIN_VALUE stays reachable
            return Math.addExact(Math.multiplyExact(seconds + 1, MICROS_PER_SECOND), micros - MICROS_PER_SECOND);
        }
        return Math.addExact(Math.multiplyExact(seconds, MICROS_PER_SECOND), micros);
    }

    /**
     * Like {@link #toEpochMicros(Instant)} but clamps instants outside the representable range
     * to {@link Long#MIN_VALUE} or {@link Long#MAX_VALUE}. For range bounds only.
     */
    public static long toEpochMicrosSaturated(Instant instant) {
        if (instant.isBefore(MIN_KEY_INSTANT)) {
            return Long.MIN_VALUE;
        }
        if (instant.isAfter(MAX_KEY_INSTANT)) {
            return Long.MAX_VALUE;
        }
        return toEpochMicros(instant);
    }

    public static Instant fromEpochMicros(long micros) {
        return Instant.ofEpochSecond(Math.floorDiv(micros, MICROS_PER_SECOND), Math.floorMod(micros, MICROS_PER_SECOND) * 1_000L);
    }
}
