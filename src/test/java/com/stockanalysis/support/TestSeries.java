package com.stockanalysis.support;

import com.stockanalysis.domain.model.Candle;
import com.stockanalysis.domain.model.OhlcvSeries;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Builds daily candle series for tests. Bars start 2025-01-01 09:15 and are one day apart. */
public final class TestSeries {

    private static final LocalDate FIRST_DAY = LocalDate.of(2025, 1, 1);

    private TestSeries() {}

    /** Each close becomes a bar with high = close + 1 and low = close - 1. */
    public static OhlcvSeries fromCloses(String symbol, double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(candle(i, closes[i], closes[i] + 1, closes[i] - 1, closes[i]));
        }
        return OhlcvSeries.of(symbol, "day", candles);
    }

    /** {@code bars} closes starting at {@code start}, moving by {@code step} per bar. */
    public static OhlcvSeries linear(String symbol, int bars, double start, double step) {
        double[] closes = new double[bars];
        for (int i = 0; i < bars; i++) {
            closes[i] = start + i * step;
        }
        return fromCloses(symbol, closes);
    }

    /** Geometric random walk with daily moves of up to +/-3%. */
    public static OhlcvSeries randomWalk(String symbol, int bars, long seed) {
        Random random = new Random(seed);
        double[] closes = new double[bars];
        double price = 50 + random.nextDouble() * 2000;
        for (int i = 0; i < bars; i++) {
            price = price * (1 + (random.nextDouble() - 0.5) * 0.06);
            closes[i] = Math.round(price * 100) / 100.0;
        }
        return fromCloses(symbol, closes);
    }

    public static Candle candle(int dayIndex, double open, double high, double low, double close) {
        return Candle.builder()
                .timestamp(FIRST_DAY.plusDays(dayIndex).atTime(9, 15))
                .open(BigDecimal.valueOf(open))
                .high(BigDecimal.valueOf(high))
                .low(BigDecimal.valueOf(low))
                .close(BigDecimal.valueOf(close))
                .volume(100_000L)
                .build();
    }
}
