package com.stockanalysis.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import com.stockanalysis.domain.model.Candle;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.IndicatorValue;
import com.stockanalysis.domain.model.OhlcvSeries;
import com.stockanalysis.indicator.IndicatorCalculator;
import com.stockanalysis.indicator.IndicatorConfig;
import com.stockanalysis.indicator.IndicatorParams;
import com.stockanalysis.indicator.IndicatorPipeline;
import com.stockanalysis.indicator.IndicatorPipelineConfig;
import com.stockanalysis.indicator.MomentumCalculator;
import com.stockanalysis.indicator.TrendCalculator;
import com.stockanalysis.support.MutableClock;
import com.stockanalysis.support.TestSeries;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;

class IndicatorPipelineTest {

    private IndicatorConfig indicatorConfig;
    private IndicatorPipeline pipeline;

    @BeforeEach
    void setUp() {
        indicatorConfig = new IndicatorConfig();
        MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        pipeline = new IndicatorPipelineConfig().indicatorPipeline(indicatorConfig, clock);
    }

    @Nested
    @DisplayName("Directional trends")
    class Directional {

        @Test
        @DisplayName("A steadily rising series scores bullish on every directional indicator")
        void risingSeries() {
            IndicatorSet set = pipeline.compute(TestSeries.linear("INFY", 60, 100, 1));

            assertThat(set.unavailableKinds()).isEmpty();
            assertThat(set.getBarCount()).isEqualTo(60);
            assertThat(set.available(IndicatorKind.TREND).get().getScore()).isGreaterThan(0.5);
            assertThat(set.available(IndicatorKind.MOMENTUM).get().getValue()).isGreaterThan(50);
            assertThat(set.available(IndicatorKind.MACD).get().getScore()).isPositive();
        }

        @Test
        @DisplayName("A steadily falling series scores bearish on every directional indicator")
        void fallingSeries() {
            IndicatorSet set = pipeline.compute(TestSeries.linear("INFY", 60, 200, -1));

            assertThat(set.available(IndicatorKind.TREND).get().getScore()).isLessThan(-0.5);
            assertThat(set.available(IndicatorKind.MOMENTUM).get().getValue()).isLessThan(50);
            assertThat(set.available(IndicatorKind.MACD).get().getScore()).isNegative();
        }

        @Test
        @DisplayName("A flat series has neutral momentum and zero volatility")
        void flatSeries() {
            double[] closes = new double[60];
            Arrays.fill(closes, 250.0);
            IndicatorSet set = pipeline.compute(TestSeries.fromCloses("ITC", closes));

            IndicatorValue momentum = set.available(IndicatorKind.MOMENTUM).get();
            assertThat(momentum.component("rsi")).isEqualTo(50.0);
            assertThat(momentum.getValue()).isCloseTo(50.0, within(1e-9));
            assertThat(set.available(IndicatorKind.VOLATILITY).get().getValue()).isCloseTo(0.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Trend strength and volume")
    class TrendStrengthAndVolume {

        @Test
        @DisplayName("A steady climb reads as a strong trend led by +DI")
        void steadyClimbIsStrong() {
            IndicatorValue adx = pipeline.compute(TestSeries.linear("INFY", 60, 100, 1))
                    .available(IndicatorKind.ADX).get();

            assertThat(adx.getValue()).isGreaterThan(40.0);
            assertThat(adx.component("plusDi")).isGreaterThan(adx.component("minusDi"));
            assertThat(adx.getScore()).isNull();
        }

        @Test
        @DisplayName("A flat series has no trend strength")
        void flatSeriesHasZeroAdx() {
            double[] closes = new double[60];
            Arrays.fill(closes, 250.0);

            IndicatorValue adx = pipeline.compute(TestSeries.fromCloses("ITC", closes))
                    .available(IndicatorKind.ADX).get();

            assertThat(adx.getValue()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Volume change compares the last bar with the period average")
        void volumeChange() {
            List<Candle> candles = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                candles.add(TestSeries.candle(i, 100, 101, 99, 100));
            }
            candles.add(Candle.builder()
                    .timestamp(candles.get(23).getTimestamp().plusDays(1))
                    .open(BigDecimal.valueOf(100))
                    .high(BigDecimal.valueOf(101))
                    .low(BigDecimal.valueOf(99))
                    .close(BigDecimal.valueOf(100))
                    .volume(200_000L)
                    .build());

            IndicatorValue volume = pipeline.compute(OhlcvSeries.of("SBIN", "day", candles))
                    .available(IndicatorKind.VOLUME_CHANGE).get();

            // average of the last 20 bars: (19 * 100000 + 200000) / 20 = 105000
            assertThat(volume.component("averageVolume")).isCloseTo(105_000.0, within(1e-6));
            assertThat(volume.getValue()).isCloseTo(95_000.0 / 105_000.0 * 100, within(1e-6));
        }
    }

    @Nested
    @DisplayName("Output ranges")
    class Ranges {

        @Test
        @DisplayName("Scores stay within their ranges over many random walks")
        void randomWalksStayInRange() {
            for (long seed = 1; seed <= 50; seed++) {
                IndicatorSet set = pipeline.compute(TestSeries.randomWalk("RW" + seed, 150, seed));

                assertThat(set.unavailableKinds()).as("seed %d", seed).isEmpty();
                assertThat(set.available(IndicatorKind.TREND).get().getValue()).isBetween(-1.0, 1.0);
                assertThat(set.available(IndicatorKind.MACD).get().getValue()).isBetween(-1.0, 1.0);
                assertThat(set.available(IndicatorKind.MOMENTUM).get().getValue()).isBetween(0.0, 100.0);
                assertThat(set.available(IndicatorKind.VOLATILITY).get().getValue()).isNotNegative();
                assertThat(set.available(IndicatorKind.ADX).get().getValue()).isBetween(0.0, 100.0);

                IndicatorValue levels = set.available(IndicatorKind.SUPPORT_RESISTANCE).get();
                assertThat(levels.getLower()).isLessThan(levels.getValue());
                assertThat(levels.getUpper()).isGreaterThan(levels.getValue());
            }
        }
    }

    @Nested
    @DisplayName("Short and missing history")
    class ShortHistory {

        @Test
        @DisplayName("Ten bars leave every indicator with insufficient data")
        void tenBars() {
            IndicatorSet set = pipeline.compute(TestSeries.linear("TCS", 10, 100, 1));

            assertThat(set.unavailableKinds()).containsExactlyElementsOf(pipeline.kinds());
            IndicatorValue trend = set.find(IndicatorKind.TREND).get();
            assertThat(trend.getStatus()).isEqualTo(IndicatorStatus.INSUFFICIENT_DATA);
            assertThat(trend.getRequiredBars()).isEqualTo(50);
            assertThat(trend.getAvailableBars()).isEqualTo(10);
            assertThat(trend.getValue()).isNull();
        }

        @Test
        @DisplayName("Twenty bars are enough for momentum, levels and volume but not for trend")
        void twentyBars() {
            IndicatorSet set = pipeline.compute(TestSeries.linear("TCS", 20, 100, 1));

            assertThat(set.available(IndicatorKind.MOMENTUM)).isPresent();
            assertThat(set.available(IndicatorKind.SUPPORT_RESISTANCE)).isPresent();
            assertThat(set.unavailableKinds())
                    .containsExactly(IndicatorKind.TREND, IndicatorKind.MACD, IndicatorKind.VOLATILITY, IndicatorKind.ADX);
            assertThat(set.available(IndicatorKind.VOLUME_CHANGE)).isPresent();
        }

        @Test
        @DisplayName("An empty series yields an all-insufficient set instead of failing")
        void emptySeries() {
            IndicatorSet set = pipeline.compute(OhlcvSeries.of("TCS", "day", List.of()));

            assertThat(set.getBarCount()).isZero();
            assertThat(set.getValues()).hasSize(7);
            assertThat(set.getValues().values()).allMatch(v -> v.getStatus() == IndicatorStatus.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("Configured periods change the required history")
        void configuredLookback() {
            indicatorConfig.getParams().put(IndicatorKind.TREND, Map.<String, Object>of("slowPeriod", 8, "fastPeriod", 4, "slopeLookback", 2));

            IndicatorSet set = pipeline.compute(TestSeries.linear("TCS", 10, 100, 1));

            assertThat(set.available(IndicatorKind.TREND)).isPresent();
        }
    }

    @Nested
    @DisplayName("Isolation")
    class Isolation {

        @Test
        @DisplayName("A failing calculator is reported as failed and the others still run")
        void failingCalculatorIsolated() {
            IndicatorCalculator broken = new IndicatorCalculator() {
                @Override
                public IndicatorKind kind() {
                    return IndicatorKind.MACD;
                }

                @Override
                public int lookback(IndicatorParams params) {
                    return 1;
                }

                @Override
                public IndicatorValue compute(BarSeries series, IndicatorParams params) {
                    throw new IllegalStateException("division by zero");
                }
            };
            IndicatorPipeline custom = new IndicatorPipeline(
                    List.of(new TrendCalculator(), broken, new MomentumCalculator()),
                    indicatorConfig,
                    new MutableClock(Instant.parse("2026-01-05T10:00:00Z")));

            IndicatorSet set = custom.compute(TestSeries.linear("SBIN", 60, 100, 1));

            assertThat(set.getValues().keySet())
                    .containsExactly(IndicatorKind.TREND, IndicatorKind.MACD, IndicatorKind.MOMENTUM);
            IndicatorValue macd = set.find(IndicatorKind.MACD).get();
            assertThat(macd.getStatus()).isEqualTo(IndicatorStatus.FAILED);
            assertThat(macd.getMessage()).isEqualTo("division by zero");
            assertThat(set.available(IndicatorKind.TREND)).isPresent();
            assertThat(set.available(IndicatorKind.MOMENTUM)).isPresent();
        }

        @Test
        @DisplayName("The same history always gives the same values")
        void deterministic() {
            OhlcvSeries series = TestSeries.randomWalk("HDFCBANK", 120, 7);

            assertThat(pipeline.compute(series).getValues()).isEqualTo(pipeline.compute(series).getValues());
        }
    }
}
