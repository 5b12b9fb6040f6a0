package com.stockanalysis.domain.model;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Output of one indicator for one symbol.
 *
 * <p>{@code value} is the indicator's headline number in its own range (trend and MACD
 * in [-1, 1], momentum in [0, 100], prices for support/resistance). {@code score} puts
 * directional indicators on a common [-1, 1] scale for aggregation; it is null for
 * non-directional ones. Band indicators fill {@code lower} and {@code upper}.
 */
@Value
@Builder
public class IndicatorValue {

    IndicatorKind kind;
    IndicatorStatus status;
    Double value;
    Double score;
    Double lower;
    Double upper;
    int requiredBars;
    int availableBars;

    /** Raw intermediate values (SMA levels, MACD line, extra support levels...). */
    @Singular
    Map<String, Double> components;

    String message;

    public static IndicatorValue insufficient(IndicatorKind kind, int requiredBars, int availableBars) {
        return IndicatorValue.builder()
                .kind(kind)
                .status(IndicatorStatus.INSUFFICIENT_DATA)
                .requiredBars(requiredBars)
                .availableBars(availableBars)
                .message("Needs " + requiredBars + " bars, have " + availableBars)
                .build();
    }

    public static IndicatorValue failed(IndicatorKind kind, int availableBars, String message) {
        return IndicatorValue.builder()
                .kind(kind)
                .status(IndicatorStatus.FAILED)
                .availableBars(availableBars)
                .message(message)
                .build();
    }

    public boolean isAvailable() {
        return status == IndicatorStatus.OK;
    }

    public Double component(String name) {
        return components.get(name);
    }
}
