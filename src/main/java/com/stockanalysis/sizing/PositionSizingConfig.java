package com.stockanalysis.sizing;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Position sizing inputs, bound from {@code analysis.sizing.*}.
 *
 * <p>Defaults: 1,00,000 account, 2% risked per trade, no single position above 10% of
 * the account.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.sizing")
public class PositionSizingConfig {

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal accountSize = new BigDecimal("100000");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private BigDecimal riskPercentage = new BigDecimal("2.0");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private BigDecimal maxPositionPercentage = new BigDecimal("10.0");

    /** Assumed per-share risk, in percent of price, when the stop sits on the price. */
    @NotNull
    private BigDecimal fallbackRiskPercentage = new BigDecimal("1.0");
}
