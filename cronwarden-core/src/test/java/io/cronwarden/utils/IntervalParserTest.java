package io.cronwarden.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntervalParserTest {

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), IntervalParser.parseDuration("5 minutes"));
        assertEquals(Duration.ofMinutes(90), IntervalParser.parseDuration("1 hour 30 minutes"));
        assertEquals(Duration.ofHours(2), IntervalParser.parseDuration("2h"));
    }

    @Test
    void numericValuesAreSeconds() {
        assertEquals("*/5 * * * *", IntervalParser.toCron("300"));
    }

    @Test
    void subMinuteIntervalRunsEveryMinute() {
        assertEquals("* * * * *", IntervalParser.toCron("30"));
        assertEquals("* * * * *", IntervalParser.toCron("1 minute"));
    }

    @Test
    void wholeHoursAndDaysUseCoarserFields() {
        assertEquals("0 * * * *", IntervalParser.toCron("1 hour"));
        assertEquals("0 */6 * * *", IntervalParser.toCron("6h"));
        assertEquals("0 0 * * *", IntervalParser.toCron("1d"));
        assertEquals("0 */8 * * *", IntervalParser.toCron("8 hours"));
    }

    @Test
    void unevenStepsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("7 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("45m"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("5h"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("2 days"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("1 day 1 hour"));
    }

    @Test
    void intervalsThatCannotBeExpressedAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("90 minutes"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("0"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("5 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.toCron("5 minutes extra"));
    }
}
