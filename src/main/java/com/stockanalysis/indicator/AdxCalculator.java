package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.adx.MinusDIIndicator;
import org.ta4j.core.indicators.adx.PlusDIIndicator;

/**
 * Average Directional Index in [0, 100]: how strong the trend is, whatever its direction.
 * The +DI and -DI lines are kept as components. A series with no directional movement at
 * all reads 0.
 */
public class AdxCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.ADX;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return 2 * params.getParamOrDefault("period", 14) + 1;
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int period = params.getParamOrDefault("period", 14);
        int end = series.getEndIndex();

        double adx = finiteOrZero(new ADXIndicator(series, period).getValue(end).doubleValue());
        double plusDi = finiteOrZero(new PlusDIIndicator(series, period).getValue(end).doubleValue());
        double minusDi = finiteOrZero(new MinusDIIndicator(series, period).getValue(end).doubleValue());

        return IndicatorValue.builder()
                .kind(IndicatorKind.ADX)
                .status(IndicatorStatus.OK)
                .value(IndicatorCalculator.clamp(adx, 0.0, 100.0))
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("plusDi", plusDi)
                .component("minusDi", minusDi)
                .build();
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
