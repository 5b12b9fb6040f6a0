package com.stockanalysis.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Service;

/**
 * Answers whether the cash market is in session. Used to decide whether live quotes are
 * worth fetching and how often the periodic job runs.
 */
@Service
public class MarketHoursService {

    private final MarketHoursConfig marketHoursConfig;
    private final Clock clock;
    private final ZoneId zone;

    public MarketHoursService(MarketHoursConfig marketHoursConfig, Clock clock) {
        this.marketHoursConfig = marketHoursConfig;
        this.clock = clock;
        this.zone = ZoneId.of(marketHoursConfig.getTimezone());
    }

    public boolean isMarketOpen() {
        return isMarketOpen(ZonedDateTime.now(clock));
    }

    /** Testable version: open from the session open (inclusive) to the close (exclusive). */
    public boolean isMarketOpen(ZonedDateTime at) {
        ZonedDateTime local = at.withZoneSameInstant(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(marketHoursConfig.getOpen()) && time.isBefore(marketHoursConfig.getClose());
    }

    /** Weekdays that are not configured holidays. */
    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return marketHoursConfig.getHolidays().stream().noneMatch(h -> date.equals(h.getDate()));
    }

    /** Today's date on the exchange calendar. */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public ZoneId zone() {
        return zone;
    }
}
