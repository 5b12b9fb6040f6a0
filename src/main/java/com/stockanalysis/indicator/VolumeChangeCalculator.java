package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;

/** Last bar's volume against its {@code period}-bar average, in percent. */
public class VolumeChangeCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.VOLUME_CHANGE;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return params.getParamOrDefault("period", 20);
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int period = params.getParamOrDefault("period", 20);
        int end = series.getEndIndex();

        VolumeIndicator volume = new VolumeIndicator(series);
        double current = volume.getValue(end).doubleValue();
        double average = new SMAIndicator(volume, period).getValue(end).doubleValue();
        double changePct = average > 0 ? (current - average) / average * 100 : 0.0;

        return IndicatorValue.builder()
                .kind(IndicatorKind.VOLUME_CHANGE)
                .status(IndicatorStatus.OK)
                .value(changePct)
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("currentVolume", current)
                .component("averageVolume", average)
                .build();
    }
}
