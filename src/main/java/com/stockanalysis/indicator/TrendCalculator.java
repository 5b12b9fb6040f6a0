package com.stockanalysis.indicator;

import static com.stockanalysis.indicator.IndicatorCalculator.clamp;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Trend score in [-1, 1] from moving-average structure.
 *
 * <p>Two parts:
 * <ul>
 *   <li><b>Alignment</b> (60%): where price sits against the fast and slow SMA. Price above a
 *       rising stack (price &gt; fast &gt; slow) is a strong uptrend, mirrored for downtrends,
 *       with intermediate steps for partial alignment.</li>
 *   <li><b>Slope</b> (40%): percentage change of the fast SMA over {@code slopeLookback} bars,
 *       squashed through tanh with {@code slopeScale} as the unit.</li>
 * </ul>
 *
 * <p>Params: {@code fastPeriod} (20), {@code slowPeriod} (50), {@code slopeLookback} (5),
 * {@code slopeScale} (0.02).
 */
public class TrendCalculator implements IndicatorCalculator {

    private static final double ALIGNMENT_WEIGHT = 0.6;
    private static final double SLOPE_WEIGHT = 0.4;

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.TREND;
    }

    @Override
    public int lookback(IndicatorParams params) {
        int slow = params.getParamOrDefault("slowPeriod", 50);
        int slopeLookback = params.getParamOrDefault("slopeLookback", 5);
        return Math.max(slow, params.getParamOrDefault("fastPeriod", 20) + slopeLookback);
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int fastPeriod = params.getParamOrDefault("fastPeriod", 20);
        int slowPeriod = params.getParamOrDefault("slowPeriod", 50);
        int slopeLookback = params.getParamOrDefault("slopeLookback", 5);
        double slopeScale = params.getDoubleParamOrDefault("slopeScale", 0.02);

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        SMAIndicator fastSma = new SMAIndicator(close, fastPeriod);
        SMAIndicator slowSma = new SMAIndicator(close, slowPeriod);
        int end = series.getEndIndex();

        double price = close.getValue(end).doubleValue();
        double fast = fastSma.getValue(end).doubleValue();
        double slow = slowSma.getValue(end).doubleValue();
        double fastBefore = fastSma.getValue(end - slopeLookback).doubleValue();

        double alignment = (alignmentScore(price, fast, slow) - 50) / 50.0;
        double slopePct = fastBefore != 0 ? (fast - fastBefore) / fastBefore : 0.0;
        double slope = Math.tanh(slopePct / slopeScale);
        double trend = clamp(ALIGNMENT_WEIGHT * alignment + SLOPE_WEIGHT * slope, -1.0, 1.0);

        return IndicatorValue.builder()
                .kind(IndicatorKind.TREND)
                .status(IndicatorStatus.OK)
                .value(trend)
                .score(trend)
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("smaFast", fast)
                .component("smaSlow", slow)
                .component("alignment", alignment)
                .component("slopePct", slopePct * 100)
                .build();
    }

    /**
     * 0..100 ladder: 100 strong up, 75 moderate up, 60 weak up, 50 undecided,
     * 40 weak down, 25 moderate down, 0 strong down.
     */
    static int alignmentScore(double price, double fast, double slow) {
        if (price > fast) {
            if (fast > slow) {
                return 100;
            }
            return price > slow ? 75 : 60;
        }
        if (price < fast) {
            if (fast < slow) {
                return 0;
            }
            return price < slow ? 25 : 40;
        }
        return 50;
    }
}
