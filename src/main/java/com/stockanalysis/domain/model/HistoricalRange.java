package com.stockanalysis.domain.model;

import java.time.LocalDate;
import lombok.Value;

/** Inclusive date range and candle interval for a historical data request. */
@Value
public class HistoricalRange {

    LocalDate from;
    LocalDate to;

    /** Broker interval name: "day", "60minute", "15minute", ... */
    String interval;

    public static HistoricalRange lastDays(LocalDate today, int days, String interval) {
        return new HistoricalRange(today.minusDays(days), today, interval);
    }
}
