package io.runcoord.utils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Timezone-aware "next occurrence" evaluation of schedule cron expressions.
 * <p>
 * Both the claim-time pre-advance and the stuck-claim reset go through {@link #nextAfter}, so the two
 * paths always agree on when a schedule fires next.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field Unix cron: {@code "0 9 * * 1"} (minute hour day-of-month month day-of-week, 0/7 = Sunday)</li>
 *   <li>6-field cron with leading seconds, Quartz day-of-week numbering (1 = Sunday)</li>
 *   <li>7-field Quartz expressions with year, passed through unchanged</li>
 * </ul>
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    /**
     * Computes the first fire time strictly after {@code after}.
     *
     * @param cronExpression schedules.cronExpression
     * @param timezone       schedules.timezone (IANA, nullable; null or blank means UTC)
     * @param after          exclusive lower bound
     */
    public static Instant nextAfter(String cronExpression, String timezone, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }
        CronExpression exp = compile(cronExpression, timezone);

        Date next = exp.getNextValidTimeAfter(Date.from(after));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cronExpression);
        }
        return next.toInstant();
    }

    /**
     * Throws {@link IllegalArgumentException} unless the expression and zone can be evaluated.
     */
    public static void validate(String cronExpression, String timezone) {
        compile(cronExpression, timezone);
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5-field Unix cron gets a "0" seconds field and Unix day-of-week numbers.
     * - 6-field cron is taken as seconds-first.
     * - Exactly one of day-of-month/day-of-week becomes "?".
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], unixDayOfWeekToQuartz(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static CronExpression compile(String cronExpression, String timezone) {
        String cron = normalizeCron(cronExpression);
        if (!CronExpression.isValidExpression(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
        ZoneId zone = resolveZone(timezone);
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (Exception ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression, ex);
        }
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("?".equals(dom) || "?".equals(dow)) {
            return String.join(" ", sec, min, hour, dom, month, dow);
        }
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            throw new IllegalArgumentException(
                    "Restricting both day-of-month and day-of-week is not supported: " + dayOfMonth + " " + dayOfWeek);
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /*
     * Unix: 0-7 with 0 and 7 = Sunday. Quartz: 1-7 with 1 = Sunday.
     * Day names and steps are kept, only numbers in lists and ranges are shifted.
     */
    private static String unixDayOfWeekToQuartz(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }

        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            String range = part;
            String step = "";
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = part.substring(slash);
            }

            String[] bounds = range.split("-");
            if (bounds.length == 2 && isDigits(bounds[0]) && "7".equals(bounds[1])) {
                // e.g. 5-7 (Fri..Sun) wraps past Saturday in Quartz numbering
                out.append(shiftDay(bounds[0])).append("-7").append(step).append(",1");
                continue;
            }

            for (int i = 0; i < bounds.length; i++) {
                if (i > 0) {
                    out.append('-');
                }
                out.append(isDigits(bounds[i]) ? shiftDay(bounds[i]) : bounds[i]);
            }
            out.append(step);
        }
        return out.toString();
    }

    private static String shiftDay(String unixDay) {
        int day = Integer.parseInt(unixDay);
        if (day < 0 || day > 7) {
            throw new IllegalArgumentException("Day-of-week out of range: " + unixDay);
        }
        return Integer.toString((day % 7) + 1);
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }
}
