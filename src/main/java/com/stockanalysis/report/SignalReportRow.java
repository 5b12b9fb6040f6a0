package com.stockanalysis.report;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Flat, serialization-friendly view of a {@link SymbolReport}. One entry in the JSON report. */
@Data
public class SignalReportRow {

    private String symbol;
    private long cycleId;
    private String status;
    private String message;
    private Map<String, String> fetchStatuses;

    private BigDecimal previousClose;
    private BigDecimal currentPrice;
    private Double volatilityPercent;

    private String direction;
    private String rawDirection;
    private Double confidencePercent;
    private Double profitProbabilityPercent;

    private BigDecimal targetPrice;
    private BigDecimal stopLoss;
    private Double riskReward;
    private Integer daysToTarget;

    private Double trendScore;
    private Double momentumScore;
    private Double rsi;
    private Double macd;
    private Double adx;
    private Double volumeChangePercent;

    private BigDecimal supportLevel;
    private BigDecimal resistanceLevel;
    private List<Double> supportLevels;
    private List<Double> resistanceLevels;

    private BigDecimal atmStrike;
    private Double atmIv;
    private Double ivPercentile;
    private BigDecimal maxPain;
    private Double putCallOiRatio;

    private String optionSymbol;
    private BigDecimal selectedStrike;
    private LocalDate optionExpiry;
    private String optionType;
    private String strikeType;
    private boolean optionLiquid;
    private BigDecimal optionCurrentPremium;
    private BigDecimal optionTargetPremium;
    private BigDecimal optionStopPremium;

    private long quantity;
    private BigDecimal positionValue;
    private BigDecimal riskAmount;

    private List<String> unavailableInputs;
    private List<String> notes;
}
