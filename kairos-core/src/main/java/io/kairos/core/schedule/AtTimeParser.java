package io.kairos.core.schedule;

import io.kairos.core.job.JobValidationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code --at} argument of one-shot jobs into epoch millis.
 *
 * <p>Accepted forms: {@code in 15m}, {@code in 2 hours}, {@code today}, {@code tomorrow at 9am},
 * ISO-8601 instants, {@code yyyy-MM-dd HH:mm} and ISO local date-times in the given zone.
 */
public final class AtTimeParser {
    private static final Pattern RELATIVE = Pattern.compile(
        "^in\\s+(\\d+)\\s*(s|sec|secs|seconds?|m|min|mins|minutes?|h|hr|hrs|hours?|d|days?)$"
    );
    private static final Pattern DAY_AT = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern CLOCK_12H = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern CLOCK_24H = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);

    private final Clock clock;
    private final ZoneId zone;

    public AtTimeParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public long parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new JobValidationException("time expression is required");
        }
        String raw = expression.trim();
        String lower = raw.toLowerCase(Locale.ROOT);

        Matcher relative = RELATIVE.matcher(lower);
        if (relative.matches()) {
            long amount = Long.parseLong(relative.group(1));
            return clock.instant().plus(unit(relative.group(2)).multipliedBy(amount)).toEpochMilli();
        }

        Matcher dayAt = DAY_AT.matcher(lower);
        if (dayAt.matches()) {
            LocalDate date = LocalDate.ofInstant(clock.instant(), zone);
            if ("tomorrow".equals(dayAt.group(1))) {
                date = date.plusDays(1);
            }
            LocalTime time = dayAt.group(2) == null ? DEFAULT_TIME : clockTime(dayAt.group(2));
            return date.atTime(time).atZone(zone).toInstant().toEpochMilli();
        }

        List<Function<String, Instant>> absolute = List.of(
            Instant::parse,
            value -> LocalDateTime.parse(value, SPACED).atZone(zone).toInstant(),
            value -> LocalDateTime.parse(value).atZone(zone).toInstant()
        );
        for (Function<String, Instant> attempt : absolute) {
            try {
                return attempt.apply(raw).toEpochMilli();
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        throw new JobValidationException("unable to parse time expression: " + expression);
    }

    private Duration unit(String token) {
        return switch (token.charAt(0)) {
            case 's' -> Duration.ofSeconds(1);
            case 'm' -> Duration.ofMinutes(1);
            case 'h' -> Duration.ofHours(1);
            case 'd' -> Duration.ofDays(1);
            default -> throw new JobValidationException("unsupported time unit: " + token);
        };
    }

    private LocalTime clockTime(String token) {
        String value = token.replace(" ", "");
        try {
            Matcher twelve = CLOCK_12H.matcher(value);
            if (twelve.matches()) {
                int hour = Integer.parseInt(twelve.group(1)) % 12;
                if ("pm".equals(twelve.group(3))) {
                    hour += 12;
                }
                return LocalTime.of(hour, minuteOf(twelve.group(2)));
            }
            Matcher twentyFour = CLOCK_24H.matcher(value);
            if (twentyFour.matches()) {
                return LocalTime.of(Integer.parseInt(twentyFour.group(1)), minuteOf(twentyFour.group(2)));
            }
        } catch (DateTimeException e) {
            throw new JobValidationException("invalid time of day: " + token, e);
        }
        throw new JobValidationException("invalid time of day: " + token);
    }

    private int minuteOf(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }
}
