package com.stockanalysis.indicator;

import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares the indicator list explicitly. Order here is the order values appear in every
 * {@link com.stockanalysis.domain.model.IndicatorSet} and in reports; adding an indicator
 * means adding a calculator to this list.
 */
@Configuration
public class IndicatorPipelineConfig {

    @Bean
    public IndicatorPipeline indicatorPipeline(IndicatorConfig indicatorConfig, Clock clock) {
        return new IndicatorPipeline(
                List.of(
                        new TrendCalculator(),
                        new MomentumCalculator(),
                        new MacdCalculator(),
                        new SupportResistanceCalculator(),
                        new VolatilityCalculator(),
                        new AdxCalculator(),
                        new VolumeChangeCalculator()),
                indicatorConfig,
                clock);
    }
}
