package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.ta4j.core.BarSeries;

/**
 * Annualized historical volatility in percent: sample standard deviation of
 * close-to-close returns over {@code window} bars, times sqrt({@code periodsPerYear}).
 * Also exposes the mean absolute bar return, which the signal aggregator uses to
 * estimate how long a move to target should take.
 */
public class VolatilityCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.VOLATILITY;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return params.getParamOrDefault("window", 30) + 1;
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int window = params.getParamOrDefault("window", 30);
        int periodsPerYear = params.getParamOrDefault("periodsPerYear", 252);

        DescriptiveStatistics returns = new DescriptiveStatistics();
        DescriptiveStatistics absoluteReturns = new DescriptiveStatistics();
        int end = series.getEndIndex();
        for (int i = end - window + 1; i <= end; i++) {
            double previous = series.getBar(i - 1).getClosePrice().doubleValue();
            double current = series.getBar(i).getClosePrice().doubleValue();
            double change = current / previous - 1;
            returns.addValue(change);
            absoluteReturns.addValue(Math.abs(change));
        }

        double annualized = returns.getStandardDeviation() * Math.sqrt(periodsPerYear) * 100;
        return IndicatorValue.builder()
                .kind(IndicatorKind.VOLATILITY)
                .status(IndicatorStatus.OK)
                .value(annualized)
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("meanAbsReturnPct", absoluteReturns.getMean() * 100)
                .build();
    }
}
