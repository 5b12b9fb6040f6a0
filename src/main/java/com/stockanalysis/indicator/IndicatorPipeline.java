package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.IndicatorValue;
import com.stockanalysis.domain.model.OhlcvSeries;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;

/**
 * Runs a fixed, ordered list of {@link IndicatorCalculator}s over one symbol's history.
 *
 * <p>The series is converted to a ta4j {@link BarSeries} once and shared by all
 * calculators. A calculator whose lookback exceeds the available bars yields an
 * insufficient-data value; a calculator that throws yields a failed value. Neither stops
 * the remaining calculators.
 *
 * <p>Stateless apart from configuration; safe to call from several compute threads.
 */
public class IndicatorPipeline {

    private static final Logger log = LoggerFactory.getLogger(IndicatorPipeline.class);

    private final List<IndicatorCalculator> calculators;
    private final IndicatorConfig indicatorConfig;
    private final Clock clock;

    public IndicatorPipeline(List<IndicatorCalculator> calculators, IndicatorConfig indicatorConfig, Clock clock) {
        this.calculators = List.copyOf(calculators);
        this.indicatorConfig = indicatorConfig;
        this.clock = clock;
    }

    public IndicatorSet compute(OhlcvSeries ohlcv) {
        ZoneId zone = ZoneId.of(indicatorConfig.getTimezone());
        LocalDateTime computedAt = LocalDateTime.now(clock.withZone(zone));
        int bars = ohlcv.size();
        Map<IndicatorKind, IndicatorValue> values = new LinkedHashMap<>();

        BarSeries series = bars > 0 ? BarSeriesConverter.toBarSeries(ohlcv, zone) : null;
        for (IndicatorCalculator calculator : calculators) {
            IndicatorParams params = indicatorConfig.paramsFor(calculator.kind());
            int required = calculator.lookback(params);
            if (bars < required) {
                values.put(calculator.kind(), IndicatorValue.insufficient(calculator.kind(), required, bars));
                continue;
            }
            values.put(calculator.kind(), computeSafely(calculator, series, params, ohlcv.getSymbol()));
        }

        log.debug("Indicators for {}: {} bars, unavailable={}", ohlcv.getSymbol(), bars,
                values.values().stream().filter(v -> !v.isAvailable()).map(IndicatorValue::getKind).toList());
        return new IndicatorSet(ohlcv.getSymbol(), computedAt, bars, values);
    }

    public List<IndicatorKind> kinds() {
        return calculators.stream().map(IndicatorCalculator::kind).toList();
    }

    private IndicatorValue computeSafely(
            IndicatorCalculator calculator, BarSeries series, IndicatorParams params, String symbol) {
        try {
            IndicatorValue value = calculator.compute(series, params);
            if (value.getValue() != null && !Double.isFinite(value.getValue())) {
                return IndicatorValue.failed(calculator.kind(), series.getBarCount(), "Non-finite result");
            }
            return value;
        } catch (RuntimeException e) {
            log.warn("Indicator {} failed for {}: {}", calculator.kind(), symbol, e.getMessage(), e);
            return IndicatorValue.failed(calculator.kind(), series.getBarCount(), e.getMessage());
        }
    }
}
