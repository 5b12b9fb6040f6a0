package com.stockanalysis.report;

import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.MarketDataType;
import com.stockanalysis.domain.enums.OptionType;
import com.stockanalysis.domain.enums.StrikeType;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.IndicatorValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from {@link SymbolReport} to the flat {@link SignalReportRow}.
 *
 * <p>Indicator figures live in an {@link IndicatorSet} keyed by kind, so they are pulled
 * out with named helper methods; everything else is a nested property path.
 */
@Mapper
public interface SignalReportMapper {

    @Mapping(source = "fetchStatuses", target = "fetchStatuses", qualifiedByName = "fetchStatuses")
    @Mapping(source = "signal.currentPrice", target = "currentPrice")
    @Mapping(source = "signal.direction", target = "direction")
    @Mapping(source = "signal.rawDirection", target = "rawDirection")
    @Mapping(source = "signal.confidence", target = "confidencePercent", qualifiedByName = "percent")
    @Mapping(source = "signal.profitProbability", target = "profitProbabilityPercent", qualifiedByName = "optionalPercent")
    @Mapping(source = "signal.targetPrice", target = "targetPrice")
    @Mapping(source = "signal.stopLoss", target = "stopLoss")
    @Mapping(source = "signal.riskReward", target = "riskReward")
    @Mapping(source = "signal.daysToTarget", target = "daysToTarget")
    @Mapping(source = "signal.supportLevel", target = "supportLevel")
    @Mapping(source = "signal.resistanceLevel", target = "resistanceLevel")
    @Mapping(source = "signal.unavailableInputs", target = "unavailableInputs")
    @Mapping(source = "signal.notes", target = "notes")
    @Mapping(source = "signal.indicators", target = "volatilityPercent", qualifiedByName = "volatilityPercent")
    @Mapping(source = "signal.indicators", target = "trendScore", qualifiedByName = "trendScore")
    @Mapping(source = "signal.indicators", target = "momentumScore", qualifiedByName = "momentumScore")
    @Mapping(source = "signal.indicators", target = "rsi", qualifiedByName = "rsi")
    @Mapping(source = "signal.indicators", target = "macd", qualifiedByName = "macd")
    @Mapping(source = "signal.indicators", target = "adx", qualifiedByName = "adx")
    @Mapping(source = "signal.indicators", target = "volumeChangePercent", qualifiedByName = "volumeChangePercent")
    @Mapping(source = "signal.indicators", target = "supportLevels", qualifiedByName = "supportLevels")
    @Mapping(source = "signal.indicators", target = "resistanceLevels", qualifiedByName = "resistanceLevels")
    @Mapping(source = "signal.optionAnalysis.atmStrike", target = "atmStrike")
    @Mapping(source = "signal.optionAnalysis.atmIv", target = "atmIv")
    @Mapping(source = "signal.optionAnalysis.ivPercentile", target = "ivPercentile")
    @Mapping(source = "signal.optionAnalysis.maxPain", target = "maxPain")
    @Mapping(source = "signal.optionAnalysis.putCallOiRatio", target = "putCallOiRatio")
    @Mapping(source = "signal.recommendedStrike.tradingSymbol", target = "optionSymbol")
    @Mapping(source = "signal.recommendedStrike.strike", target = "selectedStrike")
    @Mapping(source = "signal.recommendedStrike.expiry", target = "optionExpiry")
    @Mapping(source = "signal.recommendedStrike.optionType", target = "optionType", qualifiedByName = "optionType")
    @Mapping(source = "signal.recommendedStrike.strikeType", target = "strikeType", qualifiedByName = "strikeType")
    @Mapping(source = "signal.recommendedStrike.liquid", target = "optionLiquid")
    @Mapping(source = "signal.recommendedStrike.currentPremium", target = "optionCurrentPremium")
    @Mapping(source = "signal.recommendedStrike.targetPremium", target = "optionTargetPremium")
    @Mapping(source = "signal.recommendedStrike.stopPremium", target = "optionStopPremium")
    @Mapping(source = "signal.positionSizing.quantity", target = "quantity")
    @Mapping(source = "signal.positionSizing.positionValue", target = "positionValue")
    @Mapping(source = "signal.positionSizing.riskAmount", target = "riskAmount")
    SignalReportRow toRow(SymbolReport report);

    List<SignalReportRow> toRows(List<SymbolReport> reports);

    @Named("percent")
    default Double percent(double fraction) {
        return Math.round(fraction * 1000) / 10.0;
    }

    @Named("optionalPercent")
    default Double optionalPercent(Double fraction) {
        return fraction != null ? percent(fraction) : null;
    }

    @Named("fetchStatuses")
    default Map<String, String> fetchStatuses(Map<MarketDataType, FetchStatus> statuses) {
        if (statuses == null) {
            return null;
        }
        Map<String, String> names = new LinkedHashMap<>();
        statuses.forEach((type, status) -> names.put(type.name(), status.name()));
        return names;
    }

    @Named("optionType")
    default String optionType(OptionType optionType) {
        return optionType != null ? optionType.name() : null;
    }

    @Named("strikeType")
    default String strikeType(StrikeType strikeType) {
        return strikeType != null ? strikeType.name() : null;
    }

    @Named("volatilityPercent")
    default Double volatilityPercent(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.VOLATILITY).map(IndicatorValue::getValue).orElse(null);
    }

    @Named("trendScore")
    default Double trendScore(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.TREND).map(IndicatorValue::getScore).orElse(null);
    }

    @Named("momentumScore")
    default Double momentumScore(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.MOMENTUM).map(IndicatorValue::getValue).orElse(null);
    }

    @Named("rsi")
    default Double rsi(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.MOMENTUM).map(v -> v.component("rsi")).orElse(null);
    }

    @Named("macd")
    default Double macd(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.MACD).map(v -> v.component("macd")).orElse(null);
    }

    @Named("adx")
    default Double adx(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.ADX).map(IndicatorValue::getValue).orElse(null);
    }

    @Named("volumeChangePercent")
    default Double volumeChangePercent(IndicatorSet indicators) {
        return available(indicators, IndicatorKind.VOLUME_CHANGE).map(IndicatorValue::getValue).orElse(null);
    }

    @Named("supportLevels")
    default List<Double> supportLevels(IndicatorSet indicators) {
        return levels(indicators, "support_");
    }

    @Named("resistanceLevels")
    default List<Double> resistanceLevels(IndicatorSet indicators) {
        return levels(indicators, "resistance_");
    }

    static List<Double> levels(IndicatorSet indicators, String prefix) {
        List<Double> levels = new ArrayList<>();
        available(indicators, IndicatorKind.SUPPORT_RESISTANCE).ifPresent(v -> {
            for (int i = 1; v.component(prefix + i) != null; i++) {
                levels.add(v.component(prefix + i));
            }
        });
        return levels;
    }

    /** Reports without a signal carry no indicator set. */
    static Optional<IndicatorValue> available(IndicatorSet indicators, IndicatorKind kind) {
        return indicators != null ? indicators.available(kind) : Optional.empty();
    }
}
