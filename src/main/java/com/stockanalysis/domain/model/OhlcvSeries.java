package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Chronologically ordered candles for one symbol at one interval.
 *
 * <p>Construction rejects out-of-order or duplicate timestamps, so every consumer can
 * rely on index order being time order. Instances are immutable and safe to share
 * across the per-symbol compute threads.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "candles")
public final class OhlcvSeries {

    private final String symbol;
    private final String interval;
    private final List<Candle> candles;

    private OhlcvSeries(String symbol, String interval, List<Candle> candles) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.candles = List.copyOf(candles);
        for (int i = 1; i < this.candles.size(); i++) {
            if (!this.candles.get(i).getTimestamp().isAfter(this.candles.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException("Candles for " + symbol + " are not strictly increasing at index " + i
                        + ": " + this.candles.get(i - 1).getTimestamp() + " -> "
                        + this.candles.get(i).getTimestamp());
            }
        }
    }

    public static OhlcvSeries of(String symbol, String interval, List<Candle> candles) {
        return new OhlcvSeries(symbol, interval, candles);
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle last() {
        if (candles.isEmpty()) {
            throw new IllegalStateException("Series for " + symbol + " is empty");
        }
        return candles.get(candles.size() - 1);
    }

    /** Close of the most recent candle, or null for an empty series. */
    public BigDecimal lastClose() {
        return candles.isEmpty() ? null : last().getClose();
    }
}
