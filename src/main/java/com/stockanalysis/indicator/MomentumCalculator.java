package com.stockanalysis.indicator;

import static com.stockanalysis.indicator.IndicatorCalculator.clamp;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.ROCIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Momentum score in [0, 100], read like an RSI: above 50 is bullish, below 50 bearish.
 *
 * <p>Blends four components, each normalized to [0, 1]:
 * <ul>
 *   <li>RSI, mapped from [30, 70] (weight 0.2)</li>
 *   <li>rate of change in percent, mapped from [-10, 10] (weight 0.3)</li>
 *   <li>price relative to the fast SMA, mapped from [-10%, +10%] (weight 0.3)</li>
 *   <li>price relative to the slow SMA, mapped from [-20%, +20%] (weight 0.2)</li>
 * </ul>
 * Components whose period exceeds the available bars are left out and the remaining
 * weights are renormalized, so a short history still gets a score from RSI alone.
 *
 * <p>ta4j reports RSI 0 when there were neither gains nor losses; a flat window is
 * treated as RSI 50 here.
 */
public class MomentumCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.MOMENTUM;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return params.getParamOrDefault("rsiPeriod", 14) + 1;
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int rsiPeriod = params.getParamOrDefault("rsiPeriod", 14);
        int rocPeriod = params.getParamOrDefault("rocPeriod", 10);
        int fastPeriod = params.getParamOrDefault("fastPeriod", 20);
        int slowPeriod = params.getParamOrDefault("slowPeriod", 50);

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int end = series.getEndIndex();
        int bars = series.getBarCount();
        double price = close.getValue(end).doubleValue();

        IndicatorValue.IndicatorValueBuilder builder = IndicatorValue.builder()
                .kind(IndicatorKind.MOMENTUM)
                .status(IndicatorStatus.OK)
                .requiredBars(lookback(params))
                .availableBars(bars);

        double rsi = isFlat(close, end, rsiPeriod) ? 50.0 : new RSIIndicator(close, rsiPeriod).getValue(end).doubleValue();
        builder.component("rsi", rsi);
        double weighted = 0.2 * clamp((rsi - 30) / 40, 0, 1);
        double totalWeight = 0.2;

        if (bars > rocPeriod) {
            double roc = new ROCIndicator(close, rocPeriod).getValue(end).doubleValue();
            builder.component("rocPct", roc);
            weighted += 0.3 * clamp((roc + 10) / 20, 0, 1);
            totalWeight += 0.3;
        }
        if (bars >= fastPeriod) {
            double sma = new SMAIndicator(close, fastPeriod).getValue(end).doubleValue();
            double distance = price / sma - 1;
            builder.component("priceVsFastSmaPct", distance * 100);
            weighted += 0.3 * clamp((distance + 0.1) / 0.2, 0, 1);
            totalWeight += 0.3;
        }
        if (bars >= slowPeriod) {
            double sma = new SMAIndicator(close, slowPeriod).getValue(end).doubleValue();
            double distance = price / sma - 1;
            builder.component("priceVsSlowSmaPct", distance * 100);
            weighted += 0.2 * clamp((distance + 0.2) / 0.4, 0, 1);
            totalWeight += 0.2;
        }

        double momentum = clamp(100.0 * weighted / totalWeight, 0, 100);
        return builder.value(momentum).score((momentum - 50) / 50).build();
    }

    private static boolean isFlat(ClosePriceIndicator close, int end, int period) {
        double first = close.getValue(end - period).doubleValue();
        for (int i = end - period + 1; i <= end; i++) {
            if (close.getValue(i).doubleValue() != first) {
                return false;
            }
        }
        return true;
    }
}
