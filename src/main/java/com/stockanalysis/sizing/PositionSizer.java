package com.stockanalysis.sizing;

import com.stockanalysis.domain.enums.Direction;
import com.stockanalysis.domain.model.PositionSizing;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sizes a cash-equity position from the distance to the stop loss.
 *
 * <p>Formula: shares = (accountSize * riskPercentage / 100) / |price - stop|, rounded down,
 * then capped so the position value stays within {@code maxPositionPercentage} of the
 * account. When the stop coincides with the price, {@code fallbackRiskPercentage} of the
 * price is assumed as the per-share risk. Neutral signals size to zero.
 */
@Component
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PositionSizingConfig positionSizingConfig;

    public PositionSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    public PositionSizing size(BigDecimal price, BigDecimal stopLoss, Direction direction) {
        if (direction == Direction.NEUTRAL || price == null || price.signum() <= 0) {
            return PositionSizing.none();
        }

        BigDecimal account = positionSizingConfig.getAccountSize();
        BigDecimal maxRisk = account.multiply(positionSizingConfig.getRiskPercentage())
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);

        BigDecimal riskPerShare = stopLoss != null ? price.subtract(stopLoss).abs() : BigDecimal.ZERO;
        if (riskPerShare.signum() == 0) {
            riskPerShare = price.multiply(positionSizingConfig.getFallbackRiskPercentage())
                    .divide(HUNDRED, 4, RoundingMode.HALF_UP);
        }

        long quantity = maxRisk.divide(riskPerShare, 0, RoundingMode.DOWN).longValue();
        BigDecimal maxPositionValue = account.multiply(positionSizingConfig.getMaxPositionPercentage())
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        long cappedQuantity = maxPositionValue.divide(price, 0, RoundingMode.DOWN).longValue();
        if (quantity > cappedQuantity) {
            log.debug("Position capped from {} to {} shares by max position {}", quantity, cappedQuantity, maxPositionValue);
            quantity = cappedQuantity;
        }

        BigDecimal positionValue = price.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
        return PositionSizing.builder()
                .quantity(quantity)
                .positionValue(positionValue)
                .accountPercentage(positionValue.multiply(HUNDRED).divide(account, 2, RoundingMode.HALF_UP))
                .riskAmount(riskPerShare.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP))
                .build();
    }
}
