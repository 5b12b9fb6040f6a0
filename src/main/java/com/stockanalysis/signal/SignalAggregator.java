package com.stockanalysis.signal;

import com.stockanalysis.domain.enums.Direction;
import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.SignalStatus;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.IndicatorValue;
import com.stockanalysis.domain.model.OptionAnalysis;
import com.stockanalysis.domain.model.PositionSizing;
import com.stockanalysis.domain.model.Signal;
import com.stockanalysis.domain.model.StrikeRecommendation;
import com.stockanalysis.option.OptionChainAnalyzer;
import com.stockanalysis.sizing.PositionSizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Combines indicator values and option chain metrics into one {@link Signal}.
 *
 * <p><b>Direction</b>: majority vote of trend, momentum and MACD. Momentum votes by its
 * side of 50, the others by the sign of their score. A tie goes to the momentum vote;
 * without one the call is neutral.
 *
 * <p><b>Confidence</b>: weighted average, over the factors that are available, of how much
 * each factor agrees with the vote ({@code (1 + sign * score) / 2}). A neutral vote is
 * scored by how flat the factors are ({@code 1 - |score|}). The result is multiplied by
 * {@code 1 - penalty} once per missing or insufficient input, so degraded data can only
 * lower confidence. A directional call is then scaled by trend strength: ADX below
 * {@code weakTrendAdx} multiplies it by {@code weakTrendConfidenceMultiplier}, ADX above
 * {@code strongTrendAdx} by {@code strongTrendConfidenceMultiplier}.
 *
 * <p><b>Levels</b>: the target sits {@code targetBandMultiple} band widths beyond the
 * current price in the call's direction; the stop sits on the nearest level on the other
 * side, never closer than {@code minStopDistancePct}. A call whose reward/risk falls below
 * {@code riskRewardThreshold} is downgraded to neutral and keeps its raw vote for reference.
 */
@Service
public class SignalAggregator {

    private static final Logger log = LoggerFactory.getLogger(SignalAggregator.class);

    private static final int PRICE_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SignalPolicyConfig policy;
    private final OptionChainAnalyzer optionChainAnalyzer;
    private final PositionSizer positionSizer;
    private final Clock clock;

    public SignalAggregator(
            SignalPolicyConfig policy, OptionChainAnalyzer optionChainAnalyzer, PositionSizer positionSizer, Clock clock) {
        this.policy = policy;
        this.optionChainAnalyzer = optionChainAnalyzer;
        this.positionSizer = positionSizer;
        this.clock = clock;
    }

    public Signal aggregate(SignalInputs inputs) {
        BigDecimal price = inputs.getCurrentPrice();
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("A positive current price is required for " + inputs.getSymbol());
        }
        IndicatorSet indicators = inputs.getIndicators();
        OptionAnalysis optionAnalysis =
                inputs.getOptionChain() != null ? optionChainAnalyzer.analyze(inputs.getOptionChain(), price) : null;

        Map<SignalFactor, Double> scores = factorScores(indicators, optionAnalysis, price);
        Direction rawDirection = vote(indicators);

        List<String> unavailable = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        int degradedInputs = 0;
        for (String input : inputs.getUnavailableInputs()) {
            unavailable.add(input);
            degradedInputs++;
        }
        int insufficientInputs = 0;
        if (indicators != null) {
            for (IndicatorKind kind : indicators.unavailableKinds()) {
                unavailable.add(kind.name());
                insufficientInputs++;
            }
        }
        if (optionAnalysis != null && optionAnalysis.isReducedConfidence()) {
            unavailable.add("OPTION_ANALYSIS");
            notes.add("Option analysis reduced: " + String.join(", ", optionAnalysis.getReasons()));
            insufficientInputs++;
        }

        double confidence = confidence(scores, rawDirection)
                * Math.pow(1 - policy.getInsufficientDataPenalty(), insufficientInputs)
                * Math.pow(1 - policy.getDegradedPenalty(), degradedInputs);
        confidence = Math.max(0.0, Math.min(1.0, trendStrengthAdjusted(confidence, rawDirection, indicators, notes)));
        if (indicators == null) {
            notes.add("No price history; indicators unavailable");
            confidence = 0.0;
        }

        Band band = band(indicators, price, notes);
        BigDecimal target = target(rawDirection, price, band);
        BigDecimal stop = stop(rawDirection, price, band);
        double riskReward = riskReward(price, target, stop);

        Direction direction = rawDirection;
        if (rawDirection != Direction.NEUTRAL && riskReward < policy.getRiskRewardThreshold()) {
            notes.add(String.format(
                    "Downgraded from %s: risk/reward %.2f below %.2f",
                    rawDirection, riskReward, policy.getRiskRewardThreshold()));
            direction = Direction.NEUTRAL;
        }

        PositionSizing sizing = positionSizer.size(price, stop, direction);
        Optional<StrikeRecommendation> strike = inputs.getOptionChain() != null
                ? optionChainAnalyzer.recommendStrike(inputs.getOptionChain(), price, target, stop, direction)
                : Optional.empty();

        Signal signal = Signal.builder()
                .symbol(inputs.getSymbol())
                .cycleId(inputs.getCycleId())
                .generatedAt(LocalDateTime.now(clock))
                .direction(direction)
                .rawDirection(rawDirection)
                .confidence(confidence)
                .currentPrice(price)
                .targetPrice(target)
                .stopLoss(stop)
                .supportLevel(band.support())
                .resistanceLevel(band.resistance())
                .riskReward(riskReward)
                .daysToTarget(direction == Direction.NEUTRAL ? null : daysToTarget(indicators, price, target))
                .profitProbability(profitProbability(direction, confidence, indicators))
                .status(unavailable.isEmpty() ? SignalStatus.COMPLETE : SignalStatus.DEGRADED)
                .unavailableInputs(unavailable)
                .notes(notes)
                .indicators(indicators)
                .optionAnalysis(optionAnalysis)
                .recommendedStrike(strike.orElse(null))
                .positionSizing(sizing)
                .build();

        log.info(
                "Signal {}: {} (raw {}) confidence={} price={} target={} stop={} rr={} status={}",
                signal.getSymbol(),
                direction,
                rawDirection,
                String.format("%.2f", confidence),
                price,
                target,
                stop,
                String.format("%.2f", riskReward),
                signal.getStatus());
        return signal;
    }

    /** Majority vote of the directional indicators; momentum breaks ties. */
    Direction vote(IndicatorSet indicators) {
        if (indicators == null) {
            return Direction.NEUTRAL;
        }
        Direction momentumVote = indicators.available(IndicatorKind.MOMENTUM)
                .map(v -> Direction.fromSign(v.getValue() - 50))
                .orElse(Direction.NEUTRAL);
        Direction trendVote = indicators.available(IndicatorKind.TREND)
                .map(v -> Direction.fromSign(v.getScore()))
                .orElse(Direction.NEUTRAL);
        Direction macdVote = indicators.available(IndicatorKind.MACD)
                .map(v -> Direction.fromSign(v.getScore()))
                .orElse(Direction.NEUTRAL);

        int bullish = 0;
        int bearish = 0;
        for (Direction vote : List.of(trendVote, momentumVote, macdVote)) {
            if (vote == Direction.BULLISH) {
                bullish++;
            } else if (vote == Direction.BEARISH) {
                bearish++;
            }
        }
        if (bullish > bearish) {
            return Direction.BULLISH;
        }
        if (bearish > bullish) {
            return Direction.BEARISH;
        }
        return momentumVote;
    }

    private Map<SignalFactor, Double> factorScores(IndicatorSet indicators, OptionAnalysis optionAnalysis, BigDecimal price) {
        Map<SignalFactor, Double> scores = new EnumMap<>(SignalFactor.class);
        if (indicators != null) {
            indicators.available(IndicatorKind.TREND).map(IndicatorValue::getScore)
                    .ifPresent(s -> scores.put(SignalFactor.TREND, s));
            indicators.available(IndicatorKind.MOMENTUM).map(IndicatorValue::getScore)
                    .ifPresent(s -> scores.put(SignalFactor.MOMENTUM, s));
            indicators.available(IndicatorKind.MACD).map(IndicatorValue::getScore)
                    .ifPresent(s -> scores.put(SignalFactor.MACD, s));
        }
        if (optionAnalysis != null && optionAnalysis.getMaxPain() != null) {
            double distance = optionAnalysis.getMaxPain().subtract(price)
                    .divide(price, 6, RoundingMode.HALF_UP)
                    .doubleValue();
            scores.put(SignalFactor.MAX_PAIN, Math.tanh(distance / policy.getMaxPainScale()));
        }
        return scores;
    }

    private double confidence(Map<SignalFactor, Double> scores, Direction direction) {
        double weighted = 0;
        double totalWeight = 0;
        for (Map.Entry<SignalFactor, Double> entry : scores.entrySet()) {
            double weight = policy.weightOf(entry.getKey());
            if (weight <= 0) {
                continue;
            }
            double score = Math.max(-1.0, Math.min(1.0, entry.getValue()));
            double agreement = direction == Direction.NEUTRAL
                    ? 1 - Math.abs(score)
                    : (1 + direction.getSign() * score) / 2;
            weighted += weight * agreement;
            totalWeight += weight;
        }
        return totalWeight > 0 ? weighted / totalWeight : 0.0;
    }

    private Band band(IndicatorSet indicators, BigDecimal price, List<String> notes) {
        Optional<IndicatorValue> levels =
                indicators != null ? indicators.available(IndicatorKind.SUPPORT_RESISTANCE) : Optional.empty();
        if (levels.isPresent() && levels.get().getLower() != null && levels.get().getUpper() != null) {
            return new Band(scaled(levels.get().getLower()), scaled(levels.get().getUpper()));
        }
        notes.add("Support/resistance unavailable, using a " + policy.getFallbackBandPct() + "% band");
        BigDecimal offset = price.multiply(BigDecimal.valueOf(policy.getFallbackBandPct()))
                .divide(HUNDRED, PRICE_SCALE, RoundingMode.HALF_UP);
        return new Band(price.subtract(offset), price.add(offset));
    }

    private double trendStrengthAdjusted(
            double confidence, Direction direction, IndicatorSet indicators, List<String> notes) {
        Optional<Double> adx = adx(indicators);
        if (direction == Direction.NEUTRAL || adx.isEmpty()) {
            return confidence;
        }
        if (adx.get() < policy.getWeakTrendAdx()) {
            notes.add(String.format("Weak trend (ADX %.1f), confidence scaled by %.2f",
                    adx.get(), policy.getWeakTrendConfidenceMultiplier()));
            return confidence * policy.getWeakTrendConfidenceMultiplier();
        }
        if (adx.get() > policy.getStrongTrendAdx()) {
            return confidence * policy.getStrongTrendConfidenceMultiplier();
        }
        return confidence;
    }

    /**
     * Confidence adjusted for trend strength and reduced by annualized volatility. Null for
     * neutral signals, which do not suggest a trade.
     */
    private Double profitProbability(Direction direction, double confidence, IndicatorSet indicators) {
        if (direction == Direction.NEUTRAL) {
            return null;
        }
        double probability = confidence;
        Optional<Double> adx = adx(indicators);
        if (adx.isPresent() && adx.get() < policy.getWeakTrendAdx()) {
            probability *= policy.getWeakTrendProbabilityMultiplier();
        } else if (adx.isPresent() && adx.get() > policy.getStrongTrendAdx()) {
            probability *= policy.getStrongTrendProbabilityMultiplier();
        }
        Optional<Double> volatilityPct = indicators == null
                ? Optional.empty()
                : indicators.available(IndicatorKind.VOLATILITY).map(IndicatorValue::getValue);
        if (volatilityPct.isPresent()) {
            probability *= Math.max(0.0, 1 - volatilityPct.get() / 100 * policy.getVolatilityProbabilityDrag());
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }

    private static Optional<Double> adx(IndicatorSet indicators) {
        return indicators == null
                ? Optional.empty()
                : indicators.available(IndicatorKind.ADX).map(IndicatorValue::getValue);
    }

    private BigDecimal target(Direction direction, BigDecimal price, Band band) {
        BigDecimal width = band.resistance().subtract(band.support()).abs()
                .multiply(BigDecimal.valueOf(policy.getTargetBandMultiple()));
        BigDecimal target = switch (direction) {
            case BULLISH -> price.add(width);
            case BEARISH -> price.subtract(width).max(new BigDecimal("0.01"));
            case NEUTRAL -> price;
        };
        return target.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private BigDecimal stop(Direction direction, BigDecimal price, Band band) {
        BigDecimal minDistance = price.multiply(BigDecimal.valueOf(policy.getMinStopDistancePct()))
                .divide(HUNDRED, 4, RoundingMode.HALF_UP);
        BigDecimal stop = switch (direction) {
            case BULLISH, NEUTRAL -> band.support().min(price.subtract(minDistance));
            case BEARISH -> band.resistance().max(price.add(minDistance));
        };
        return stop.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static double riskReward(BigDecimal price, BigDecimal target, BigDecimal stop) {
        BigDecimal risk = price.subtract(stop).abs();
        if (risk.signum() == 0) {
            return 0.0;
        }
        return target.subtract(price).abs().divide(risk, 4, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Move to target divided by the average absolute daily move, clamped to
     * [1, maxDaysToTarget]. Without volatility data the configured default is used.
     */
    private Integer daysToTarget(IndicatorSet indicators, BigDecimal price, BigDecimal target) {
        Double meanMovePct = indicators == null
                ? null
                : indicators.available(IndicatorKind.VOLATILITY)
                        .map(v -> v.component("meanAbsReturnPct"))
                        .orElse(null);
        if (meanMovePct == null || meanMovePct <= 0) {
            return policy.getDefaultDaysToTarget();
        }
        double movePct = target.subtract(price).abs().multiply(HUNDRED)
                .divide(price, 6, RoundingMode.HALF_UP)
                .doubleValue();
        long days = (long) Math.ceil(movePct / meanMovePct);
        return (int) Math.max(1, Math.min(policy.getMaxDaysToTarget(), days));
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private record Band(BigDecimal support, BigDecimal resistance) {}
}
