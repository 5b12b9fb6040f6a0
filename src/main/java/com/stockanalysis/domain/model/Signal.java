package com.stockanalysis.domain.model;

import com.stockanalysis.domain.enums.Direction;
import com.stockanalysis.domain.enums.SignalStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Directional call for one symbol in one cycle. Never updated in place: the next cycle
 * produces a new instance with a higher {@code cycleId}.
 */
@Value
@Builder
public class Signal {

    String symbol;
    long cycleId;
    LocalDateTime generatedAt;

    Direction direction;

    /** The indicator vote before the risk/reward check; differs from {@code direction} after a downgrade. */
    Direction rawDirection;

    /** 0..1 */
    double confidence;

    BigDecimal currentPrice;
    BigDecimal targetPrice;
    BigDecimal stopLoss;
    BigDecimal supportLevel;
    BigDecimal resistanceLevel;
    Double riskReward;
    Integer daysToTarget;

    /** 0..1, confidence adjusted for trend strength and volatility; null for neutral signals. */
    Double profitProbability;

    SignalStatus status;

    /** Inputs that were missing or insufficient, e.g. "HISTORICAL", "MACD", "OPTION_CHAIN". */
    @Singular
    List<String> unavailableInputs;

    /** Human-readable explanations (downgrades, fallbacks). */
    @Singular
    List<String> notes;

    IndicatorSet indicators;
    OptionAnalysis optionAnalysis;
    StrikeRecommendation recommendedStrike;
    PositionSizing positionSizing;

    public boolean isDegraded() {
        return status == SignalStatus.DEGRADED;
    }
}
