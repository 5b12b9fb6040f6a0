package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.model.IndicatorValue;
import org.ta4j.core.BarSeries;

/**
 * One technical indicator. Implementations are stateless and pure: the same series and
 * parameters always give the same value.
 *
 * <p>The pipeline checks {@link #lookback} before calling {@link #compute}, so
 * implementations may assume at least that many bars.
 */
public interface IndicatorCalculator {

    IndicatorKind kind();

    /** Minimum number of bars needed for a meaningful value. */
    int lookback(IndicatorParams params);

    IndicatorValue compute(BarSeries series, IndicatorParams params);

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
