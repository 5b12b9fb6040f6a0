package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionSizing {

    long quantity;
    BigDecimal positionValue;

    /** Position value as a percentage of the account. */
    BigDecimal accountPercentage;

    /** Amount lost if the stop is hit. */
    BigDecimal riskAmount;

    public static PositionSizing none() {
        return PositionSizing.builder()
                .quantity(0)
                .positionValue(BigDecimal.ZERO)
                .accountPercentage(BigDecimal.ZERO)
                .riskAmount(BigDecimal.ZERO)
                .build();
    }
}
