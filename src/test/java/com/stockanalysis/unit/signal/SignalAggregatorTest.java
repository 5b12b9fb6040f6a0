package com.stockanalysis.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.stockanalysis.domain.enums.Direction;
import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.enums.OptionType;
import com.stockanalysis.domain.enums.SignalStatus;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.IndicatorValue;
import com.stockanalysis.domain.model.OptionChainSnapshot;
import com.stockanalysis.domain.model.OptionContract;
import com.stockanalysis.domain.model.Signal;
import com.stockanalysis.indicator.IndicatorConfig;
import com.stockanalysis.indicator.IndicatorPipeline;
import com.stockanalysis.indicator.IndicatorPipelineConfig;
import com.stockanalysis.option.OptionAnalysisConfig;
import com.stockanalysis.option.OptionChainAnalyzer;
import com.stockanalysis.signal.SignalAggregator;
import com.stockanalysis.signal.SignalFactor;
import com.stockanalysis.signal.SignalInputs;
import com.stockanalysis.signal.SignalPolicyConfig;
import com.stockanalysis.sizing.PositionSizer;
import com.stockanalysis.sizing.PositionSizingConfig;
import com.stockanalysis.support.TestSeries;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SignalAggregatorTest {

    private static final BigDecimal PRICE = BigDecimal.valueOf(100);

    /** Weighted agreement of trend 0.8, momentum 0.6 and MACD 0.6 with a bullish vote. */
    private static final double STRONG_CONFIDENCE = (0.35 * 0.9 + 0.25 * 0.8 + 0.25 * 0.8) / 0.85;

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneId.of("Asia/Kolkata"));
    private SignalPolicyConfig policy;
    private SignalAggregator aggregator;

    @BeforeEach
    void setUp() {
        policy = new SignalPolicyConfig();
        aggregator = new SignalAggregator(
                policy,
                new OptionChainAnalyzer(new OptionAnalysisConfig()),
                new PositionSizer(new PositionSizingConfig()),
                clock);
    }

    private static IndicatorValue directional(IndicatorKind kind, double value, double score) {
        return IndicatorValue.builder()
                .kind(kind)
                .status(IndicatorStatus.OK)
                .value(value)
                .score(score)
                .build();
    }

    private static IndicatorValue levels(double lower, double upper) {
        return IndicatorValue.builder()
                .kind(IndicatorKind.SUPPORT_RESISTANCE)
                .status(IndicatorStatus.OK)
                .value(100.0)
                .lower(lower)
                .upper(upper)
                .build();
    }

    private static IndicatorValue volatility(double meanAbsReturnPct) {
        return IndicatorValue.builder()
                .kind(IndicatorKind.VOLATILITY)
                .status(IndicatorStatus.OK)
                .value(25.0)
                .component("meanAbsReturnPct", meanAbsReturnPct)
                .build();
    }

    private static IndicatorValue adx(double value) {
        return IndicatorValue.builder()
                .kind(IndicatorKind.ADX)
                .status(IndicatorStatus.OK)
                .value(value)
                .build();
    }

    private static IndicatorSet set(IndicatorValue... values) {
        Map<IndicatorKind, IndicatorValue> byKind = new LinkedHashMap<>();
        for (IndicatorValue value : values) {
            byKind.put(value.getKind(), value);
        }
        return new IndicatorSet("INFY", LocalDateTime.of(2026, 1, 5, 15, 30), 250, byKind);
    }

    private static IndicatorSet strongBullish(double lower, double upper) {
        return set(
                directional(IndicatorKind.TREND, 0.8, 0.8),
                directional(IndicatorKind.MOMENTUM, 80, 0.6),
                directional(IndicatorKind.MACD, 0.6, 0.6),
                levels(lower, upper),
                volatility(2.0));
    }

    private Signal aggregate(IndicatorSet indicators) {
        return aggregator.aggregate(SignalInputs.builder()
                .symbol("INFY")
                .cycleId(7)
                .currentPrice(PRICE)
                .indicators(indicators)
                .build());
    }

    @Nested
    @DisplayName("Direction and confidence")
    class DirectionAndConfidence {

        @Test
        @DisplayName("Agreeing bullish indicators give a bullish call with high confidence")
        void bullish() {
            Signal signal = aggregate(strongBullish(95, 110));

            assertThat(signal.getDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getRawDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getConfidence()).isCloseTo(STRONG_CONFIDENCE, within(1e-9));
            assertThat(signal.getStatus()).isEqualTo(SignalStatus.COMPLETE);
            assertThat(signal.getUnavailableInputs()).isEmpty();
            assertThat(signal.getCycleId()).isEqualTo(7);
            assertThat(signal.getGeneratedAt()).isEqualTo(LocalDateTime.of(2026, 1, 5, 15, 30));
        }

        @Test
        @DisplayName("Agreeing bearish indicators give a bearish call")
        void bearish() {
            Signal signal = aggregate(set(
                    directional(IndicatorKind.TREND, -0.8, -0.8),
                    directional(IndicatorKind.MOMENTUM, 20, -0.6),
                    directional(IndicatorKind.MACD, -0.6, -0.6),
                    levels(90, 105)));

            assertThat(signal.getDirection()).isEqualTo(Direction.BEARISH);
            assertThat(signal.getTargetPrice()).isEqualByComparingTo("85.00");
            assertThat(signal.getStopLoss()).isEqualByComparingTo("105.00");
            assertThat(signal.getRiskReward()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("A split vote without momentum is neutral")
        void splitVote() {
            Signal signal = aggregate(set(
                    directional(IndicatorKind.TREND, 0.5, 0.5),
                    directional(IndicatorKind.MACD, -0.5, -0.5),
                    levels(95, 110)));

            assertThat(signal.getRawDirection()).isEqualTo(Direction.NEUTRAL);
            assertThat(signal.getDaysToTarget()).isNull();
            assertThat(signal.getPositionSizing().getQuantity()).isZero();
        }

        @Test
        @DisplayName("Two of three votes carry the call")
        void majority() {
            Signal signal = aggregate(set(
                    directional(IndicatorKind.TREND, -0.2, -0.2),
                    directional(IndicatorKind.MOMENTUM, 65, 0.3),
                    directional(IndicatorKind.MACD, 0.4, 0.4),
                    levels(95, 110)));

            assertThat(signal.getRawDirection()).isEqualTo(Direction.BULLISH);
        }

        @Test
        @DisplayName("Confidence stays within [0, 1] for a computed history")
        void computedHistory() {
            IndicatorPipeline pipeline = new IndicatorPipelineConfig().indicatorPipeline(new IndicatorConfig(), clock);
            IndicatorSet indicators = pipeline.compute(TestSeries.linear("INFY", 80, 100, 1));

            Signal signal = aggregator.aggregate(SignalInputs.builder()
                    .symbol("INFY")
                    .currentPrice(BigDecimal.valueOf(179))
                    .indicators(indicators)
                    .build());

            assertThat(signal.getRawDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getConfidence()).isBetween(0.6, 1.0);
        }

        @Test
        @DisplayName("Fifty strictly rising bars give a bullish signal with confidence of at least 0.6")
        void fiftyRisingBars() {
            IndicatorPipeline pipeline = new IndicatorPipelineConfig().indicatorPipeline(new IndicatorConfig(), clock);
            IndicatorSet indicators = pipeline.compute(TestSeries.linear("INFY", 50, 100, 1));

            Signal signal = aggregator.aggregate(SignalInputs.builder()
                    .symbol("INFY")
                    .currentPrice(BigDecimal.valueOf(149))
                    .indicators(indicators)
                    .build());

            assertThat(indicators.unavailableKinds()).isEmpty();
            assertThat(signal.getDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getConfidence()).isGreaterThanOrEqualTo(0.6);
            assertThat(signal.getRiskReward()).isGreaterThanOrEqualTo(1.5);
        }
    }

    @Nested
    @DisplayName("Levels and risk/reward")
    class Levels {

        @Test
        @DisplayName("Target is one band width above price, stop on support")
        void targetAndStop() {
            Signal signal = aggregate(strongBullish(95, 110));

            assertThat(signal.getTargetPrice()).isEqualByComparingTo("115.00");
            assertThat(signal.getStopLoss()).isEqualByComparingTo("95.00");
            assertThat(signal.getSupportLevel()).isEqualByComparingTo("95.00");
            assertThat(signal.getResistanceLevel()).isEqualByComparingTo("110.00");
            assertThat(signal.getRiskReward()).isEqualTo(3.0);
            // 15% move at 2% a day
            assertThat(signal.getDaysToTarget()).isEqualTo(8);
        }

        @Test
        @DisplayName("The stop keeps a minimum distance from price")
        void minimumStopDistance() {
            Signal signal = aggregate(strongBullish(99.8, 110));

            assertThat(signal.getStopLoss()).isEqualByComparingTo("99.00");
        }

        @Test
        @DisplayName("A poor risk/reward downgrades to neutral but keeps the raw vote and confidence")
        void downgrade() {
            Signal signal = aggregate(strongBullish(99.5, 100.5));

            assertThat(signal.getDirection()).isEqualTo(Direction.NEUTRAL);
            assertThat(signal.getRawDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getRiskReward()).isEqualTo(1.0);
            assertThat(signal.getConfidence()).isCloseTo(STRONG_CONFIDENCE, within(1e-9));
            assertThat(signal.getNotes()).anyMatch(note -> note.startsWith("Downgraded from BULLISH"));
            assertThat(signal.getDaysToTarget()).isNull();
            assertThat(signal.getPositionSizing().getQuantity()).isZero();
        }

        @Test
        @DisplayName("A bullish call is sized from the distance to the stop")
        void sized() {
            Signal signal = aggregate(strongBullish(95, 110));

            // 2,000 at risk over 5 per share would be 400 shares, capped at 10% of the account
            assertThat(signal.getPositionSizing().getQuantity()).isEqualTo(100);
            assertThat(signal.getPositionSizing().getRiskAmount()).isEqualByComparingTo("500.00");
        }
    }

    @Nested
    @DisplayName("Missing and degraded inputs")
    class Degraded {

        @Test
        @DisplayName("A failed fetch lowers confidence and marks the signal degraded")
        void fetchFailure() {
            Signal signal = aggregator.aggregate(SignalInputs.builder()
                    .symbol("INFY")
                    .currentPrice(PRICE)
                    .indicators(strongBullish(95, 110))
                    .unavailableInput("OPTION_CHAIN")
                    .build());

            assertThat(signal.getStatus()).isEqualTo(SignalStatus.DEGRADED);
            assertThat(signal.getUnavailableInputs()).containsExactly("OPTION_CHAIN");
            assertThat(signal.getConfidence()).isCloseTo(STRONG_CONFIDENCE * 0.75, within(1e-9));
            assertThat(signal.getDirection()).isEqualTo(Direction.BULLISH);
        }

        @Test
        @DisplayName("An insufficient indicator is dropped from the vote and penalised")
        void insufficientIndicator() {
            Signal signal = aggregate(set(
                    directional(IndicatorKind.TREND, 0.8, 0.8),
                    directional(IndicatorKind.MOMENTUM, 80, 0.6),
                    IndicatorValue.insufficient(IndicatorKind.MACD, 35, 20),
                    levels(95, 110)));

            double expected = (0.35 * 0.9 + 0.25 * 0.8) / 0.6 * 0.9;
            assertThat(signal.getConfidence()).isCloseTo(expected, within(1e-9));
            assertThat(signal.getConfidence()).isLessThan((0.35 * 0.9 + 0.25 * 0.8) / 0.6);
            assertThat(signal.getUnavailableInputs()).containsExactly("MACD");
            assertThat(signal.isDegraded()).isTrue();
        }

        @Test
        @DisplayName("Without history the call is neutral with zero confidence and a fallback band")
        void noHistory() {
            Signal signal = aggregator.aggregate(SignalInputs.builder()
                    .symbol("INFY")
                    .currentPrice(PRICE)
                    .unavailableInput("HISTORICAL")
                    .build());

            assertThat(signal.getDirection()).isEqualTo(Direction.NEUTRAL);
            assertThat(signal.getConfidence()).isZero();
            assertThat(signal.getSupportLevel()).isEqualByComparingTo("97.00");
            assertThat(signal.getResistanceLevel()).isEqualByComparingTo("103.00");
            assertThat(signal.getNotes()).contains("No price history; indicators unavailable");
            assertThat(signal.getStatus()).isEqualTo(SignalStatus.DEGRADED);
        }

        @Test
        @DisplayName("A non-positive price is rejected")
        void invalidPrice() {
            assertThatThrownBy(() -> aggregator.aggregate(SignalInputs.builder()
                            .symbol("INFY")
                            .currentPrice(BigDecimal.ZERO)
                            .build()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("INFY");
        }
    }

    @Nested
    @DisplayName("Option chain")
    class OptionChain {

        private OptionChainSnapshot singleExpiryChain() {
            LocalDate expiry = LocalDate.of(2026, 1, 27);
            return OptionChainSnapshot.builder()
                    .symbol("INFY")
                    .spotPrice(PRICE)
                    .capturedAt(LocalDateTime.of(2026, 1, 5, 15, 30))
                    .contract(option(expiry, 100, OptionType.CE, 5000, 4.0))
                    .contract(option(expiry, 110, OptionType.CE, 3000, 1.5))
                    .contract(option(expiry, 100, OptionType.PE, 4000, 3.5))
                    .build();
        }

        private OptionContract option(LocalDate expiry, int strike, OptionType type, long oi, double premium) {
            return OptionContract.builder()
                    .tradingSymbol("INFY26JAN" + strike + type)
                    .strike(BigDecimal.valueOf(strike))
                    .expiry(expiry)
                    .optionType(type)
                    .openInterest(oi)
                    .impliedVolatility(22.0)
                    .lastPrice(BigDecimal.valueOf(premium))
                    .build();
        }

        @Test
        @DisplayName("The analysis and a strike recommendation are attached; a single expiry is flagged")
        void attachesAnalysis() {
            Signal signal = aggregator.aggregate(SignalInputs.builder()
                    .symbol("INFY")
                    .currentPrice(PRICE)
                    .indicators(strongBullish(95, 110))
                    .optionChain(singleExpiryChain())
                    .build());

            assertThat(signal.getOptionAnalysis()).isNotNull();
            assertThat(signal.getOptionAnalysis().getMaxPain()).isNotNull();
            assertThat(signal.getUnavailableInputs()).containsExactly("OPTION_ANALYSIS");
            assertThat(signal.getRecommendedStrike()).isNotNull();
            assertThat(signal.getRecommendedStrike().getOptionType()).isEqualTo(OptionType.CE);
            assertThat(signal.getRecommendedStrike().getStrike()).isEqualByComparingTo("110");
        }
    }

    @Nested
    @DisplayName("Policy validation")
    class PolicyValidation {

        @Test
        @DisplayName("Negative or all-zero weights are rejected")
        void weights() {
            assertThat(policy.isWeightsValid()).isTrue();

            policy.getWeights().replaceAll((factor, weight) -> 0.0);
            assertThat(policy.isWeightsValid()).isFalse();

            policy.getWeights().put(SignalFactor.TREND, -1.0);
            assertThat(policy.isWeightsValid()).isFalse();
        }

        @Test
        @DisplayName("The weak-trend ADX threshold may not exceed the strong one")
        void trendThresholds() {
            assertThat(policy.isTrendThresholdsValid()).isTrue();

            policy.setWeakTrendAdx(50.0);
            assertThat(policy.isTrendThresholdsValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Trend strength")
    class TrendStrength {

        /** Bullish set with annualized volatility 25%, so the volatility factor is 1 - 0.25 * 0.3. */
        private IndicatorSet bullishWithAdx(double adxValue) {
            return set(
                    directional(IndicatorKind.TREND, 0.8, 0.8),
                    directional(IndicatorKind.MOMENTUM, 80, 0.6),
                    directional(IndicatorKind.MACD, 0.6, 0.6),
                    levels(95, 110),
                    volatility(2.0),
                    adx(adxValue));
        }

        @Test
        @DisplayName("A weak trend scales confidence down and says so")
        void weakTrend() {
            Signal signal = aggregate(bullishWithAdx(15));

            assertThat(signal.getDirection()).isEqualTo(Direction.BULLISH);
            assertThat(signal.getConfidence()).isCloseTo(STRONG_CONFIDENCE * 0.8, within(1e-9));
            assertThat(signal.getNotes()).anyMatch(n -> n.startsWith("Weak trend (ADX 15.0)"));
            assertThat(signal.getProfitProbability()).isCloseTo(STRONG_CONFIDENCE * 0.8 * 0.9 * 0.925, within(1e-9));
        }

        @Test
        @DisplayName("A moderate trend leaves confidence unchanged")
        void moderateTrend() {
            Signal signal = aggregate(bullishWithAdx(30));

            assertThat(signal.getConfidence()).isCloseTo(STRONG_CONFIDENCE, within(1e-9));
            assertThat(signal.getProfitProbability()).isCloseTo(STRONG_CONFIDENCE * 0.925, within(1e-9));
            assertThat(signal.getStatus()).isEqualTo(SignalStatus.COMPLETE);
        }

        @Test
        @DisplayName("A strong trend raises confidence, capped at 1")
        void strongTrend() {
            Signal signal = aggregate(bullishWithAdx(45));

            assertThat(signal.getConfidence()).isEqualTo(1.0);
            assertThat(signal.getProfitProbability()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Neutral calls carry no profit probability and ignore trend strength")
        void neutralCall() {
            Signal signal = aggregate(set(
                    directional(IndicatorKind.TREND, 0.0, 0.0),
                    directional(IndicatorKind.MOMENTUM, 50, 0.0),
                    directional(IndicatorKind.MACD, 0.0, 0.0),
                    levels(95, 110),
                    adx(10)));

            assertThat(signal.getDirection()).isEqualTo(Direction.NEUTRAL);
            assertThat(signal.getConfidence()).isCloseTo(1.0, within(1e-9));
            assertThat(signal.getProfitProbability()).isNull();
            assertThat(signal.getNotes()).noneMatch(n -> n.startsWith("Weak trend"));
        }
    }
}
