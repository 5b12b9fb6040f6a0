package com.stockanalysis.indicator;

import com.stockanalysis.domain.model.Candle;
import com.stockanalysis.domain.model.OhlcvSeries;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Converts an {@link OhlcvSeries} into a ta4j {@link BarSeries}.
 *
 * <p>Candle timestamps mark the bar start; ta4j wants the bar end, so each bar is shifted
 * by one interval. The source series is already strictly ordered, which is what ta4j
 * requires of consecutive end times.
 */
public final class BarSeriesConverter {

    private BarSeriesConverter() {}

    public static BarSeries toBarSeries(OhlcvSeries ohlcv, ZoneId zone) {
        BarSeries series = new BaseBarSeriesBuilder().withName(ohlcv.getSymbol()).build();
        Duration period = intervalDuration(ohlcv.getInterval());
        for (Candle candle : ohlcv.getCandles()) {
            ZonedDateTime endTime = candle.getTimestamp().atZone(zone).plus(period);
            series.addBar(
                    period,
                    endTime,
                    candle.getOpen().doubleValue(),
                    candle.getHigh().doubleValue(),
                    candle.getLow().doubleValue(),
                    candle.getClose().doubleValue(),
                    candle.getVolume());
        }
        return series;
    }

    /**
     * Maps a broker interval name ("day", "minute", "15minute", "60minute", "week") to a duration.
     * Unknown names are treated as daily bars.
     */
    static Duration intervalDuration(String interval) {
        String normalized = interval.toLowerCase(Locale.ROOT);
        if (normalized.equals("day")) {
            return Duration.ofDays(1);
        }
        if (normalized.equals("week")) {
            return Duration.ofDays(7);
        }
        if (normalized.endsWith("minute")) {
            String count = normalized.substring(0, normalized.length() - "minute".length());
            return Duration.ofMinutes(count.isEmpty() ? 1 : Long.parseLong(count));
        }
        return Duration.ofDays(1);
    }
}
