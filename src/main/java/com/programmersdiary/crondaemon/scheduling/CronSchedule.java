package com.programmersdiary.crondaemon.scheduling;

import java.time.LocalDateTime;
import java.util.BitSet;
import java.util.Optional;

/**
 * A parsed five-field cron expression: {@code minute hour day-of-month month weekday}.
 *
 * <p>Each field accepts {@code *}, a number, a range {@code A-B}, a step applied to either
 * ({@code *}{@code /N}, {@code A-B/N}, or {@code A/N} meaning A through the field maximum) and comma
 * separated lists of those. Weekdays run 0 (Sunday) to 6 (Saturday); names are not accepted.
 *
 * <p>Day matching uses the classic Vixie cron rule: when both the day-of-month and the weekday
 * fields are restricted (their text does not start with {@code *}) a tick matches if <em>either</em>
 * one matches. Otherwise both must match, which in practice means only the restricted one counts.
 * So {@code 0 9 1 * 1} fires on the 1st of every month and on every Monday, while
 * {@code 0 9 * * 1} fires on Mondays only.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class CronSchedule {

    private static final int SEARCH_YEARS = 8;

    private enum Field {
        MINUTE("minute", 0, 59),
        HOUR("hour", 0, 23),
        DAY_OF_MONTH("day-of-month", 1, 31),
        MONTH("month", 1, 12),
        WEEKDAY("weekday", 0, 6);

        private final String label;
        private final int min;
        private final int max;

        Field(String label, int min, int max) {
            this.label = label;
            this.min = min;
            this.max = max;
        }
    }

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet weekdays;
    private final boolean dayOfMonthRestricted;
    private final boolean weekdayRestricted;

    private CronSchedule(String expression, String[] fields) {
        this.expression = String.join(" ", fields);
        this.minutes = parseField(expression, fields[0], Field.MINUTE);
        this.hours = parseField(expression, fields[1], Field.HOUR);
        this.daysOfMonth = parseField(expression, fields[2], Field.DAY_OF_MONTH);
        this.months = parseField(expression, fields[3], Field.MONTH);
        this.weekdays = parseField(expression, fields[4], Field.WEEKDAY);
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.weekdayRestricted = !fields[4].startsWith("*");
    }

    /**
     * Parses and validates an expression.
     *
     * @throws InvalidScheduleException on a wrong field count, an out-of-range value, a malformed
     *                                  step or range, or an empty list element
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, "expression is empty");
        }
        var fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(expression,
                    "expected 5 fields (minute hour day month weekday) but found " + fields.length);
        }
        return new CronSchedule(expression, fields);
    }

    public String expression() {
        return expression;
    }

    public boolean matches(Tick tick) {
        return matches(tick.time());
    }

    /**
     * First matching tick strictly after {@code from}, or empty when the expression can never match
     * (for example {@code 0 0 30 2 *}).
     */
    public Optional<Tick> nextMatchAfter(Tick from) {
        var t = from.time().plusMinutes(1);
        var limit = t.plusYears(SEARCH_YEARS);
        while (t.isBefore(limit)) {
            if (!months.get(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
            } else if (!dayMatches(t)) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
            } else if (!hours.get(t.getHour())) {
                t = t.withMinute(0).plusHours(1);
            } else if (!minutes.get(t.getMinute())) {
                t = t.plusMinutes(1);
            } else {
                return Optional.of(new Tick(t, from.offset()));
            }
        }
        return Optional.empty();
    }

    private boolean matches(LocalDateTime t) {
        return minutes.get(t.getMinute())
                && hours.get(t.getHour())
                && months.get(t.getMonthValue())
                && dayMatches(t);
    }

    private boolean dayMatches(LocalDateTime t) {
        boolean dom = daysOfMonth.get(t.getDayOfMonth());
        boolean dow = weekdays.get(t.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && weekdayRestricted) {
            return dom || dow;
        }
        return dom && dow;
    }

    private static BitSet parseField(String expression, String source, Field field) {
        var bits = new BitSet(field.max + 1);
        for (var element : source.split(",", -1)) {
            if (element.isEmpty()) {
                throw new InvalidScheduleException(expression, field.label + " field has an empty list element");
            }
            parseElement(expression, element, field, bits);
        }
        return bits;
    }

    private static void parseElement(String expression, String element, Field field, BitSet bits) {
        var range = element;
        int step = 1;
        int slash = element.indexOf('/');
        if (slash >= 0) {
            range = element.substring(0, slash);
            step = parseNumber(expression, element.substring(slash + 1), field, "step");
            if (step < 1) {
                throw new InvalidScheduleException(expression, field.label + " step must be at least 1");
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = field.min;
            to = field.max;
        } else if (range.indexOf('-') >= 0) {
            int dash = range.indexOf('-');
            from = parseValue(expression, range.substring(0, dash), field);
            to = parseValue(expression, range.substring(dash + 1), field);
            if (from > to) {
                throw new InvalidScheduleException(expression,
                        field.label + " range " + range + " runs backwards");
            }
        } else {
            from = parseValue(expression, range, field);
            to = slash >= 0 ? field.max : from;
        }

        for (int v = from; v <= to; v += step) {
            bits.set(v);
        }
    }

    private static int parseValue(String expression, String text, Field field) {
        int value = parseNumber(expression, text, field, "value");
        if (value < field.min || value > field.max) {
            throw new InvalidScheduleException(expression, field.label + " value " + value
                    + " is outside " + field.min + "-" + field.max);
        }
        return value;
    }

    private static int parseNumber(String expression, String text, Field field, String what) {
        if (text.isEmpty() || text.length() > 4 || !text.chars().allMatch(Character::isDigit)) {
            throw new InvalidScheduleException(expression,
                    field.label + " " + what + " '" + text + "' is not a number");
        }
        return Integer.parseInt(text);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CronSchedule other && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
