package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.IndicatorValue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.ta4j.core.BarSeries;

/**
 * Support and resistance levels from swing lows and swing highs.
 *
 * <p>A bar in the last {@code lookback} bars is a swing low when its low is no higher than
 * the lows of the {@code window} bars on each side (swing high: high no lower than the
 * neighbours' highs). Swing lows below the current close are support candidates, swing
 * highs above it resistance candidates.
 *
 * <p>Candidates are taken nearest-to-price first; a candidate within
 * {@code minSeparationPct} of a level already taken is dropped, so two adjacent bars
 * printing almost the same low count as one level. When a side has no candidate at all,
 * a ladder of {@code fallbackStepPct} steps away from the close stands in and the side is
 * flagged as derived.
 *
 * <p>The value is the current close; {@code lower} is the nearest support and
 * {@code upper} the nearest resistance. Components {@code support_1..n} and
 * {@code resistance_1..n} list the levels, nearest first.
 */
public class SupportResistanceCalculator implements IndicatorCalculator {

    @Override
    public IndicatorKind kind() {
        return IndicatorKind.SUPPORT_RESISTANCE;
    }

    @Override
    public int lookback(IndicatorParams params) {
        return 2 * params.getParamOrDefault("window", 5) + 1;
    }

    @Override
    public IndicatorValue compute(BarSeries series, IndicatorParams params) {
        int lookback = params.getParamOrDefault("lookback", 30);
        int window = params.getParamOrDefault("window", 5);
        int maxLevels = params.getParamOrDefault("levels", 3);
        double minSeparationPct = params.getDoubleParamOrDefault("minSeparationPct", 0.5);
        double fallbackStepPct = params.getDoubleParamOrDefault("fallbackStepPct", 2.0);

        int end = series.getEndIndex();
        int begin = series.getBeginIndex();
        double price = series.getBar(end).getClosePrice().doubleValue();
        int scanFrom = Math.max(begin + window, end - lookback + 1);

        List<Double> supportCandidates = new ArrayList<>();
        List<Double> resistanceCandidates = new ArrayList<>();
        for (int i = scanFrom; i <= end - window; i++) {
            double low = series.getBar(i).getLowPrice().doubleValue();
            double high = series.getBar(i).getHighPrice().doubleValue();
            if (low < price && isSwingLow(series, i, window)) {
                supportCandidates.add(low);
            }
            if (high > price && isSwingHigh(series, i, window)) {
                resistanceCandidates.add(high);
            }
        }

        double minSeparation = price * minSeparationPct / 100.0;
        List<Double> supports = selectLevels(supportCandidates, price, minSeparation, maxLevels);
        List<Double> resistances = selectLevels(resistanceCandidates, price, minSeparation, maxLevels);
        boolean supportDerived = supports.isEmpty();
        boolean resistanceDerived = resistances.isEmpty();
        if (supportDerived) {
            supports = ladder(price, -fallbackStepPct, maxLevels);
        }
        if (resistanceDerived) {
            resistances = ladder(price, fallbackStepPct, maxLevels);
        }

        IndicatorValue.IndicatorValueBuilder builder = IndicatorValue.builder()
                .kind(IndicatorKind.SUPPORT_RESISTANCE)
                .status(IndicatorStatus.OK)
                .value(price)
                .lower(supports.get(0))
                .upper(resistances.get(0))
                .requiredBars(lookback(params))
                .availableBars(series.getBarCount())
                .component("supportDerived", supportDerived ? 1.0 : 0.0)
                .component("resistanceDerived", resistanceDerived ? 1.0 : 0.0);
        for (int i = 0; i < supports.size(); i++) {
            builder.component("support_" + (i + 1), supports.get(i));
        }
        for (int i = 0; i < resistances.size(); i++) {
            builder.component("resistance_" + (i + 1), resistances.get(i));
        }
        return builder.build();
    }

    private static boolean isSwingLow(BarSeries series, int index, int window) {
        double low = series.getBar(index).getLowPrice().doubleValue();
        for (int j = 1; j <= window; j++) {
            if (low > series.getBar(index - j).getLowPrice().doubleValue()
                    || low > series.getBar(index + j).getLowPrice().doubleValue()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSwingHigh(BarSeries series, int index, int window) {
        double high = series.getBar(index).getHighPrice().doubleValue();
        for (int j = 1; j <= window; j++) {
            if (high < series.getBar(index - j).getHighPrice().doubleValue()
                    || high < series.getBar(index + j).getHighPrice().doubleValue()) {
                return false;
            }
        }
        return true;
    }

    /** Nearest-first selection with a minimum gap between accepted levels. */
    static List<Double> selectLevels(List<Double> candidates, double price, double minSeparation, int maxLevels) {
        List<Double> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.<Double>comparingDouble(level -> Math.abs(level - price))
                .thenComparingDouble(level -> level));
        List<Double> accepted = new ArrayList<>();
        for (double candidate : ordered) {
            if (accepted.size() == maxLevels) {
                break;
            }
            boolean tooClose = accepted.stream().anyMatch(level -> Math.abs(level - candidate) < minSeparation);
            if (!tooClose) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }

    private static List<Double> ladder(double price, double stepPct, int levels) {
        List<Double> result = new ArrayList<>(levels);
        for (int k = 1; k <= levels; k++) {
            result.add(price * (1 + k * stepPct / 100.0));
        }
        return result;
    }
}
