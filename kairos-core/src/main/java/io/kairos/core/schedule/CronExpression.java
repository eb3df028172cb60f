package io.kairos.core.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Supports {@code *}, values, ranges {@code a-b}, steps on a star, a range or a start value
 * ({@code 0-30/5}, {@code 5/15}), comma separated lists, month names {@code JAN-DEC} and weekday names {@code SUN-SAT}. Weekday
 * {@code 7} is Sunday. When both day fields are restricted a day matches if either one matches.
 */
public final class CronExpression {
    private static final int SEARCH_HORIZON_YEARS = 5;
    private static final List<String> MONTH_NAMES = List.of(
        "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    );
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], "minute", 0, 59, List.of(), 0);
        this.hours = parseField(fields[1], "hour", 0, 23, List.of(), 0);
        this.daysOfMonth = parseField(fields[2], "day-of-month", 1, 31, List.of(), 0);
        this.months = parseField(fields[3], "month", 1, 12, MONTH_NAMES, 1);
        BitSet weekdays = parseField(fields[4], "day-of-week", 0, 7, DAY_NAMES, 0);
        if (weekdays.get(7)) {
            weekdays.set(0);
            weekdays.clear(7);
        }
        this.daysOfWeek = weekdays;
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.dayOfWeekRestricted = !fields[4].startsWith("*");
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("cron expression is required");
        }
        String normalized = expression.trim();
        String[] fields = normalized.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(
                "cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + normalized
            );
        }
        return new CronExpression(normalized, fields);
    }

    public String expression() {
        return expression;
    }

    /**
     * Smallest minute strictly after {@code after}, in the zone of {@code after}.
     */
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        ZoneId zone = after.getZone();
        LocalDateTime cursor = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime horizon = cursor.plusYears(SEARCH_HORIZON_YEARS);

        while (cursor.isBefore(horizon)) {
            if (!months.get(cursor.getMonthValue())) {
                cursor = cursor.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!matchesDay(cursor.toLocalDate())) {
                cursor = cursor.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.get(cursor.getHour())) {
                cursor = cursor.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(cursor.getMinute())) {
                cursor = cursor.plusMinutes(1);
                continue;
            }
            // local times inside a DST gap resolve forward; overlaps resolve to the earlier offset
            ZonedDateTime candidate = cursor.atZone(zone);
            if (candidate.isAfter(after)) {
                return Optional.of(candidate);
            }
            cursor = cursor.plusMinutes(1);
        }
        return Optional.empty();
    }

    boolean matchesDay(LocalDate date) {
        boolean dom = daysOfMonth.get(date.getDayOfMonth());
        boolean dow = daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dom || dow;
        }
        if (dayOfMonthRestricted) {
            return dom;
        }
        if (dayOfWeekRestricted) {
            return dow;
        }
        return true;
    }

    private static BitSet parseField(String field, String label, int min, int max, List<String> names, int nameOffset) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new InvalidScheduleException("empty list element in " + label + " field: " + field);
            }

            String rangePart = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                rangePart = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label, field);
                if (step <= 0) {
                    throw new InvalidScheduleException("step must be > 0 in " + label + " field: " + field);
                }
                if (step > max) {
                    throw new InvalidScheduleException(
                        "step must be <= " + max + " in " + label + " field: " + field
                    );
                }
            }

            int start;
            int end;
            if ("*".equals(rangePart)) {
                start = min;
                end = max;
            } else {
                int dash = rangePart.indexOf('-');
                if (dash > 0) {
                    start = parseValue(rangePart.substring(0, dash), label, field, names, nameOffset);
                    end = parseValue(rangePart.substring(dash + 1), label, field, names, nameOffset);
                } else {
                    start = parseValue(rangePart, label, field, names, nameOffset);
                    end = slash >= 0 ? max : start;
                }
            }

            if (start < min || end > max) {
                throw new InvalidScheduleException(
                    label + " value out of range " + min + "-" + max + ": " + field
                );
            }
            if (start > end) {
                throw new InvalidScheduleException("descending range in " + label + " field: " + field);
            }
            for (int value = start; value <= end; value += step) {
                bits.set(value);
            }
        }
        return bits;
    }

    private static int parseValue(String token, String label, String field, List<String> names, int nameOffset) {
        if (token.isEmpty()) {
            throw new InvalidScheduleException("missing value in " + label + " field: " + field);
        }
        int named = names.indexOf(token.toUpperCase(Locale.ROOT));
        if (named >= 0) {
            return named + nameOffset;
        }
        return parseNumber(token, label, field);
    }

    private static int parseNumber(String token, String label, String field) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("invalid " + label + " field: " + field, e);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
