package io.cronwarden.utils;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleExpressionTest {

    private static ZonedDateTime utc(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    @Test
    void everyFifteenMinutesMatchesOnlyQuarterHours() {
        ScheduleExpression expr = ScheduleExpression.parse("*/15 * * * *");

        int matches = 0;
        for (int minute = 0; minute < 60; minute++) {
            if (expr.matches(utc(2026, 3, 2, 10, minute))) {
                matches++;
                assertEquals(0, minute % 15);
            }
        }
        assertEquals(4, matches);
    }

    @Test
    void dailyAtThreeMatchesExactlyOncePerDay() {
        ScheduleExpression expr = ScheduleExpression.parse("0 3 * * *");

        assertTrue(expr.matches(utc(2026, 3, 2, 3, 0)));
        assertFalse(expr.matches(utc(2026, 3, 2, 3, 1)));
        assertFalse(expr.matches(utc(2026, 3, 2, 4, 0)));
    }

    @Test
    void weeklyOnSundayAcceptsZeroAndSeven() {
        ScheduleExpression zero = ScheduleExpression.parse("0 4 * * 0");
        ScheduleExpression seven = ScheduleExpression.parse("0 4 * * 7");
        ZonedDateTime sunday = utc(2026, 3, 1, 4, 0);
        ZonedDateTime monday = utc(2026, 3, 2, 4, 0);

        assertTrue(zero.matches(sunday));
        assertTrue(seven.matches(sunday));
        assertFalse(zero.matches(monday));
        assertFalse(seven.matches(monday));
    }

    @Test
    void weekdayRangeAndListsAreSupported() {
        ScheduleExpression expr = ScheduleExpression.parse("30 9,12 * * 1-5");

        assertTrue(expr.matches(utc(2026, 3, 6, 12, 30)));  // Friday
        assertFalse(expr.matches(utc(2026, 3, 7, 12, 30))); // Saturday
        assertFalse(expr.matches(utc(2026, 3, 6, 10, 30)));
    }

    @Test
    void namesAreAcceptedForMonthAndDayOfWeek() {
        ScheduleExpression expr = ScheduleExpression.parse("0 0 * jan-mar MON");

        assertTrue(expr.matches(utc(2026, 2, 2, 0, 0)));
        assertFalse(expr.matches(utc(2026, 4, 6, 0, 0)));
    }

    @Test
    void restrictingBothDayFieldsIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("0 0 1 * 1"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("0 0 */2 * MON"));
    }

    @Test
    void dayOfWeekRangeEndingOnSevenIncludesSunday() {
        ScheduleExpression weekend = ScheduleExpression.parse("0 8 * * 5-7");
        ScheduleExpression everyDay = ScheduleExpression.parse("0 8 * * 0-7");

        assertTrue(weekend.matches(utc(2026, 3, 6, 8, 0)));  // Friday
        assertTrue(weekend.matches(utc(2026, 3, 8, 8, 0)));  // Sunday
        assertFalse(weekend.matches(utc(2026, 3, 9, 8, 0))); // Monday
        for (int day = 2; day <= 8; day++) {
            assertTrue(everyDay.matches(utc(2026, 3, day, 8, 0)));
        }
    }

    @Test
    void dayOfWeekStepCountsFromSunday() {
        ScheduleExpression expr = ScheduleExpression.parse("0 0 * * */2");

        assertTrue(expr.matches(utc(2026, 3, 1, 0, 0)));  // Sunday
        assertFalse(expr.matches(utc(2026, 3, 2, 0, 0))); // Monday
        assertTrue(expr.matches(utc(2026, 3, 3, 0, 0)));  // Tuesday
        assertTrue(expr.matches(utc(2026, 3, 7, 0, 0)));  // Saturday
    }

    @Test
    void matchingIgnoresSecondsWithinTheMinute() {
        ScheduleExpression expr = ScheduleExpression.parse("0 3 * * *");

        assertTrue(expr.matches(utc(2026, 3, 2, 3, 0).plusSeconds(42)));
    }

    @Test
    void rangeWithStep() {
        ScheduleExpression expr = ScheduleExpression.parse("10-30/10 * * * *");

        assertTrue(expr.matches(utc(2026, 1, 1, 0, 10)));
        assertTrue(expr.matches(utc(2026, 1, 1, 0, 30)));
        assertFalse(expr.matches(utc(2026, 1, 1, 0, 40)));
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("* * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("60 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("*/0 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("0 0 * * 8"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("0 0 L * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("0 0 0 * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("a * * * *"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleExpression.parse("1,,2 * * * *"));
        assertFalse(ScheduleExpression.isValid(""));
    }

    @Test
    void nextMatchAfterFindsFollowingOccurrence() {
        ScheduleExpression expr = ScheduleExpression.parse("0 4 * * 0");

        ZonedDateTime next = expr.nextMatchAfter(utc(2026, 3, 2, 10, 17));

        assertEquals(utc(2026, 3, 8, 4, 0), next);
    }

    @Test
    void nextMatchAfterIsStrictlyLater() {
        ScheduleExpression expr = ScheduleExpression.parse("0 * * * *");

        assertEquals(utc(2026, 1, 1, 11, 0), expr.nextMatchAfter(utc(2026, 1, 1, 10, 0)));
    }

    @Test
    void nextMatchAfterHonorsZone() {
        ZoneId ny = ZoneId.of("America/New_York");
        ScheduleExpression expr = ScheduleExpression.parse("30 9 * * *");

        ZonedDateTime next = expr.nextMatchAfter(ZonedDateTime.of(2026, 3, 2, 12, 0, 0, 0, ny));

        assertEquals(ZonedDateTime.of(2026, 3, 3, 9, 30, 0, 0, ny), next);
    }

    @Test
    void impossibleDateHasNoNextMatch() {
        assertNull(ScheduleExpression.parse("0 0 31 2 *").nextMatchAfter(utc(2026, 1, 1, 0, 0)));
    }
}
