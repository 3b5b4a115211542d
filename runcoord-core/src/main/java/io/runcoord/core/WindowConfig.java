package io.runcoord.core;

import java.util.Objects;

/**
 * Reporting-window configuration of a schedule.
 *
 * @param mode             rolling or fixed lookback
 * @param windowSizeDays   window length for {@link WindowMode#ROLLING}
 * @param lookbackDays     window length for {@link WindowMode#FIXED}
 * @param reportingLagDays days subtracted from "now" to get the window end
 */
public record WindowConfig(
        WindowMode mode,
        int windowSizeDays,
        int lookbackDays,
        int reportingLagDays
) {
    /**
     * The data platform cannot serve anything more recent than this.
     */
    public static final int DEFAULT_REPORTING_LAG_DAYS = 14;

    /**
     * Span used when a stored schedule carries no window length.
     */
    public static final int DEFAULT_SPAN_DAYS = 7;

    public static final int MIN_SPAN_DAYS = 1;
    public static final int MAX_SPAN_DAYS = 365;

    public WindowConfig {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    public static WindowConfig rolling(int windowSizeDays) {
        return new WindowConfig(WindowMode.ROLLING, windowSizeDays, 0, DEFAULT_REPORTING_LAG_DAYS);
    }

    public static WindowConfig fixed(int lookbackDays) {
        return new WindowConfig(WindowMode.FIXED, 0, lookbackDays, DEFAULT_REPORTING_LAG_DAYS);
    }

    public WindowConfig withReportingLagDays(int reportingLagDays) {
        return new WindowConfig(mode, windowSizeDays, lookbackDays, reportingLagDays);
    }

    /**
     * Number of days the window covers for the configured mode.
     */
    public int spanDays() {
        return mode == WindowMode.ROLLING ? windowSizeDays : lookbackDays;
    }
}
