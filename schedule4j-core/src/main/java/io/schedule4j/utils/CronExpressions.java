package io.schedule4j.utils;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Helpers around Quartz {@link CronExpression}.
 * <p>
 * Accepted input:
 * <ul>
 *   <li>5-field Unix cron: "min hour day-of-month month day-of-week" (seconds default to 0)</li>
 *   <li>6-field cron with leading seconds</li>
 *   <li>7-field Quartz cron (with year), passed through untouched</li>
 * </ul>
 * <p>
 * For 5 and 6 field input the day-of-week uses the Unix numbering (0 or 7 = Sunday) and is rewritten to
 * Quartz numbering (1 = Sunday). Quartz requires one of day-of-month / day-of-week to be "?", so a "*" on
 * either side is turned into "?". Quartz cannot express a restriction on both fields, so such input is
 * rejected with an {@link IllegalArgumentException} naming that limitation.
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    /**
     * Normalize a cron expression into Quartz syntax.
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
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = translateDayOfWeek(dayOfWeek);

        if (isWildcard(dow)) {
            dow = "?";
        } else if (isWildcard(dom)) {
            dom = "?";
        } else {
            throw new IllegalArgumentException("cron restricting both day-of-month (" + dayOfMonth
                    + ") and day-of-week (" + dayOfWeek + ") is not supported");
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    // Unix 0-7 (0 and 7 = Sunday) -> Quartz 1-7 (1 = Sunday). Step values after '/' and
    // occurrence numbers after '#' are left as they are.
    static String translateDayOfWeek(String field) {
        if (isWildcard(field)) {
            return field;
        }
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            String item = items[i];
            String suffix = "";
            int cut = indexOfAny(item, '/', '#');
            if (cut >= 0) {
                suffix = item.substring(cut);
                item = item.substring(0, cut);
            }
            StringBuilder out = new StringBuilder();
            int pos = 0;
            while (pos < item.length()) {
                char c = item.charAt(pos);
                if (Character.isDigit(c)) {
                    int end = pos;
                    while (end < item.length() && Character.isDigit(item.charAt(end))) {
                        end++;
                    }
                    int day = Integer.parseInt(item.substring(pos, end));
                    out.append(day == 7 ? 1 : day + 1);
                    pos = end;
                } else {
                    out.append(c);
                    pos++;
                }
            }
            items[i] = out + suffix;
        }
        return String.join(",", items);
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }

    /**
     * Returns true if the expression normalizes to a valid Quartz {@link CronExpression}.
     */
    public static boolean isValid(String expression) {
        try {
            return CronExpression.isValidExpression(normalizeCron(expression));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Next occurrence strictly after {@code from}, evaluated in {@code zone}.
     */
    public static Instant nextOccurrenceAfter(String expression, ZoneId zone, Instant from) {
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }
        String cron = normalizeCron(expression);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression + " (" + ex.getMessage() + ")", ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + expression);
        }
        return next.toInstant();
    }
}
