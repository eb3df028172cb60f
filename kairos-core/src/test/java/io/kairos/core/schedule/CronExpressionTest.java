package io.kairos.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class CronExpressionTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void shouldFindNextDailyRunAfterTodaysSlotPassed() {
        CronExpression cron = CronExpression.parse("0 9 * * *");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2024, 1, 1, 10, 0, 0, 0, UTC)).orElseThrow();

        assertThat(next).isEqualTo(ZonedDateTime.of(2024, 1, 2, 9, 0, 0, 0, UTC));
    }

    @Test
    void shouldBeStrictlyAfterReferenceTime() {
        CronExpression cron = CronExpression.parse("* * * * *");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2024, 1, 1, 10, 0, 0, 0, UTC)).orElseThrow();

        assertThat(next).isEqualTo(ZonedDateTime.of(2024, 1, 1, 10, 1, 0, 0, UTC));
    }

    @Test
    void shouldSupportStepsRangesAndLists() {
        CronExpression cron = CronExpression.parse("*/15 8-10 * * MON,WED");

        // 2024-01-01 is a Monday
        ZonedDateTime first = cron.next(ZonedDateTime.of(2024, 1, 1, 10, 50, 0, 0, UTC)).orElseThrow();

        assertThat(first).isEqualTo(ZonedDateTime.of(2024, 1, 3, 8, 0, 0, 0, UTC));
    }

    @Test
    void shouldSupportOpenEndedStepFromValue() {
        CronExpression cron = CronExpression.parse("5/20 * * * *");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2024, 1, 1, 10, 26, 0, 0, UTC)).orElseThrow();

        assertThat(next).isEqualTo(ZonedDateTime.of(2024, 1, 1, 10, 45, 0, 0, UTC));
    }

    @Test
    void shouldTreatSevenAsSundayAndAcceptMonthNames() {
        CronExpression cron = CronExpression.parse("30 6 * FEB 7");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2024, 1, 15, 0, 0, 0, 0, UTC)).orElseThrow();

        assertThat(next).isEqualTo(ZonedDateTime.of(2024, 2, 4, 6, 30, 0, 0, UTC));
    }

    @Test
    void shouldMatchEitherDayFieldWhenBothAreRestricted() {
        CronExpression cron = CronExpression.parse("0 0 13 * FRI");

        assertThat(cron.matchesDay(LocalDate.of(2024, 9, 13))).isTrue();
        assertThat(cron.matchesDay(LocalDate.of(2024, 9, 6))).isTrue();
        assertThat(cron.matchesDay(LocalDate.of(2024, 9, 12))).isFalse();
    }

    @Test
    void shouldHonourZoneOfReferenceTime() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        CronExpression cron = CronExpression.parse("0 9 * * *");

        ZonedDateTime next = cron.next(ZonedDateTime.of(2024, 1, 1, 10, 0, 0, 0, tokyo)).orElseThrow();

        assertThat(next.toInstant()).isEqualTo(ZonedDateTime.of(2024, 1, 2, 0, 0, 0, 0, UTC).toInstant());
    }

    @Test
    void shouldReturnEmptyForImpossibleDate() {
        CronExpression cron = CronExpression.parse("0 0 30 2 *");

        assertThat(cron.next(ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, UTC))).isEmpty();
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> CronExpression.parse("0 9 * *"))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("5 fields");
        assertThatThrownBy(() -> CronExpression.parse("61 * * * *"))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("minute");
        assertThatThrownBy(() -> CronExpression.parse("* * * * MOO"))
            .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> CronExpression.parse("*/0 * * * *"))
            .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> CronExpression.parse("5/2147483647 * * * *"))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("step must be <= 59");
        assertThatThrownBy(() -> CronExpression.parse("0 0 */99999 * *"))
            .isInstanceOf(InvalidScheduleException.class);
    }
}
