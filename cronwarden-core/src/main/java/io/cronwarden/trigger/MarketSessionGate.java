package io.cronwarden.trigger;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Trading-session window: a set of weekdays and a {@code [open, close)} local-time range in a
 * fixed zone. Exchange holidays are not modelled.
 */
public record MarketSessionGate(ZoneId zone, Set<DayOfWeek> tradingDays, LocalTime open, LocalTime close) {

    public MarketSessionGate {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(open, "open must not be null");
        Objects.requireNonNull(close, "close must not be null");
        if (tradingDays == null || tradingDays.isEmpty()) {
            throw new IllegalArgumentException("tradingDays must not be empty");
        }
        if (!open.isBefore(close)) {
            throw new IllegalArgumentException("open must be before close");
        }
        tradingDays = Set.copyOf(tradingDays);
    }

    /**
     * US equities regular session: Monday to Friday, 09:30 to 16:00 America/New_York.
     */
    public static MarketSessionGate usEquities() {
        return new MarketSessionGate(
                ZoneId.of("America/New_York"),
                EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
                LocalTime.of(9, 30),
                LocalTime.of(16, 0));
    }

    public boolean isOpen(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalTime time = local.toLocalTime();
        return tradingDays.contains(local.getDayOfWeek()) && !time.isBefore(open) && time.isBefore(close);
    }
}
