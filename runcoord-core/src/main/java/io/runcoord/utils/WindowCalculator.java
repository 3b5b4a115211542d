package io.runcoord.utils;

import io.runcoord.core.ReportWindow;
import io.runcoord.core.Schedule;
import io.runcoord.core.WindowConfig;
import io.runcoord.core.WindowMode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Computes the reporting window of an occurrence.
 *
 * <p>{@code end = now - reportingLagDays}, {@code start = end - spanDays}. For a rolling window this
 * slides forward by one schedule period per run; a fixed lookback always covers the same number of
 * trailing days. Pure function, no I/O.
 */
public final class WindowCalculator {
    private WindowCalculator() {
    }

    public static ReportWindow computeWindow(Schedule schedule, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        return computeWindow(schedule.window(), now);
    }

    public static ReportWindow computeWindow(WindowConfig config, Instant now) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(now, "now must not be null");

        int span = config.spanDays();
        if (span < WindowConfig.MIN_SPAN_DAYS || span > WindowConfig.MAX_SPAN_DAYS) {
            throw new IllegalArgumentException(
                    "window " + (config.mode() == WindowMode.ROLLING ? "size" : "lookback")
                            + " must be between " + WindowConfig.MIN_SPAN_DAYS + " and "
                            + WindowConfig.MAX_SPAN_DAYS + " days: " + span);
        }
        if (config.reportingLagDays() < 0) {
            throw new IllegalArgumentException("reportingLagDays must not be negative: " + config.reportingLagDays());
        }

        Instant end = now.minus(Duration.ofDays(config.reportingLagDays()));
        Instant start = end.minus(Duration.ofDays(span));
        return new ReportWindow(start, end);
    }
}
