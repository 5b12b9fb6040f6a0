package com.stockanalysis.indicator;

import static com.stockanalysis.indicator.IndicatorCalculator.clamp;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * MACD normalized to [-1, 1].
 *
 * <p>The MACD line and its signal-line delta (histogram) are expressed as fractions of
 * price, so the score means the same thing for a 100-rupee and a 3000-rupee stock.
 * Score = 0.7 * tanh(macd / (price * macdScale)) + 0.3 * tanh(histogram / (price * histogramScale)).
 */
public class MacdCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.MACD;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return params.getParamOrDefault("longPeriod", 26) + params.getParamOrDefault("signalPeriod", 9);
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int shortPeriod = params.getParamOrDefault("shortPeriod", 12);
        int longPeriod = params.getParamOrDefault("longPeriod", 26);
        int signalPeriod = params.getParamOrDefault("signalPeriod", 9);
        double macdScale = params.getDoubleParamOrDefault("macdScale", 0.01);
        double histogramScale = params.getDoubleParamOrDefault("histogramScale", 0.005);

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        MACDIndicator macd = new MACDIndicator(close, shortPeriod, longPeriod);
        EMAIndicator signal = new EMAIndicator(macd, signalPeriod);
        int end = series.getEndIndex();

        double price = close.getValue(end).doubleValue();
        double macdValue = macd.getValue(end).doubleValue();
        double signalValue = signal.getValue(end).doubleValue();
        double histogram = macdValue - signalValue;

        double score = clamp(
                0.7 * Math.tanh(macdValue / (price * macdScale)) + 0.3 * Math.tanh(histogram / (price * histogramScale)),
                -1.0,
                1.0);

        return IndicatorValue.builder()
                .kind(IndicatorKind.MACD)
                .status(IndicatorStatus.OK)
                .value(score)
                .score(score)
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("macd", macdValue)
                .component("signal", signalValue)
                .component("histogram", histogram)
                .build();
    }
}
