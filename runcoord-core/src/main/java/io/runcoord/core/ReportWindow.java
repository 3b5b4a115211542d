package io.runcoord.core;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Concrete {@code [start, end)} reporting window of one occurrence.
 *
 * <p>The execution API rejects timestamps with a zone suffix, so both bounds are rendered as UTC
 * local date-times ({@code 2025-08-25T09:00:00}).
 */
public record ReportWindow(Instant start, Instant end) {

    public static final DateTimeFormatter API_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    public ReportWindow {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("window start must be before end: " + start + " >= " + end);
        }
    }

    public String formattedStart() {
        return API_FORMAT.format(start);
    }

    public String formattedEnd() {
        return API_FORMAT.format(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + formattedStart() + ", " + formattedEnd() + ")";
    }
}
