package com.stockanalysis.signal;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Aggregation policy, bound from {@code analysis.signal.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.signal")
public class SignalPolicyConfig {

    private Map<SignalFactor, Double> weights = defaultWeights();

    /** Signals with a lower reward/risk ratio are downgraded to neutral. */
    @DecimalMin("0.0")
    private double riskRewardThreshold = 1.5;

    /** Target distance as a multiple of the support/resistance band width. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double targetBandMultiple = 1.0;

    /** Stop loss is kept at least this far from the current price, in percent. */
    @DecimalMin("0.0")
    private double minStopDistancePct = 1.0;

    /** Half-width of the band used when support/resistance could not be computed, in percent. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double fallbackBandPct = 3.0;

    /** Confidence multiplier (1 - penalty) per insufficient indicator or reduced option analysis. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double insufficientDataPenalty = 0.1;

    /** Confidence multiplier (1 - penalty) per input lost to a fetch failure. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double degradedPenalty = 0.25;

    /** Distance from max pain, as a fraction of price, that maps to tanh(1). */
    @DecimalMin(value = "0.0", inclusive = false)
    private double maxPainScale = 0.02;

    /** ADX below this marks a weak trend. */
    @DecimalMin("0.0")
    private double weakTrendAdx = 20.0;

    /** ADX above this marks a strong trend. */
    @DecimalMin("0.0")
    private double strongTrendAdx = 40.0;

    @DecimalMin("0.0")
    private double weakTrendConfidenceMultiplier = 0.8;

    @DecimalMin("0.0")
    private double strongTrendConfidenceMultiplier = 1.2;

    @DecimalMin("0.0")
    private double weakTrendProbabilityMultiplier = 0.9;

    @DecimalMin("0.0")
    private double strongTrendProbabilityMultiplier = 1.1;

    /** Profit probability is multiplied by (1 - annualized volatility * drag). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double volatilityProbabilityDrag = 0.3;

    @Min(1)
    private int defaultDaysToTarget = 10;

    @Min(1)
    private int maxDaysToTarget = 60;

    @AssertTrue(message = "signal weights must be non-negative with a positive sum")
    public boolean isWeightsValid() {
        if (weights == null || weights.isEmpty()) {
            return false;
        }
        double sum = 0;
        for (Double weight : weights.values()) {
            if (weight == null || weight < 0) {
                return false;
            }
            sum += weight;
        }
        return sum > 0;
    }

    @AssertTrue(message = "weak-trend ADX must not exceed strong-trend ADX")
    public boolean isTrendThresholdsValid() {
        return weakTrendAdx <= strongTrendAdx;
    }

    public double weightOf(SignalFactor factor) {
        Double weight = weights.get(factor);
        return weight != null ? weight : 0.0;
    }

    private static Map<SignalFactor, Double> defaultWeights() {
        Map<SignalFactor, Double> weights = new EnumMap<>(SignalFactor.class);
        weights.put(SignalFactor.TREND, 0.35);
        weights.put(SignalFactor.MOMENTUM, 0.25);
        weights.put(SignalFactor.MACD, 0.25);
        weights.put(SignalFactor.MAX_PAIN, 0.15);
        return weights;
    }
}
