package com.stockanalysis.option;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Option chain analysis settings, bound from {@code analysis.options.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.options")
public class OptionAnalysisConfig {

    /** Whether option chains are fetched and analyzed at all. */
    private boolean enabled = true;

    /** Number of nearest expiries to load per underlying. */
    @Min(1)
    private int expiries = 2;

    /** Minimum open interest for a strike to be recommended. */
    @Min(0)
    private long minOpenInterest = 100;

    /** A strike is "high OI" when its total OI exceeds this multiple of the mean. */
    @DecimalMin("1.0")
    private double highOiMultiple = 1.5;

    /** Extrinsic value assumed at target, in percent of the target price. */
    @DecimalMin("0.0")
    private double targetExtrinsicPct = 2.0;

    /** Extrinsic value assumed when a contract has no last price, in percent of spot. */
    @DecimalMin("0.0")
    private double fallbackExtrinsicPct = 3.0;

    /** Option stop premium never goes below this percentage of the current premium. */
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double stopPremiumFloorPct = 70.0;

    /** Annual risk-free rate used when solving implied volatility. */
    private double riskFreeRate = 0.065;

    private double dividendYield = 0.0;
}
