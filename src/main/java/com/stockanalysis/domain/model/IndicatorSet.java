package com.stockanalysis.domain.model;

import com.stockanalysis.domain.enums.IndicatorKind;
import com.stockanalysis.domain.enums.IndicatorStatus;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;

/** All indicator values for one symbol in one cycle, in pipeline order. */
@Getter
@ToString
public final class IndicatorSet {

    private final String symbol;
    private final LocalDateTime computedAt;
    private final int barCount;
    private final Map<IndicatorKind, IndicatorValue> values;

    public IndicatorSet(String symbol, LocalDateTime computedAt, int barCount, Map<IndicatorKind, IndicatorValue> values) {
        this.symbol = symbol;
        this.computedAt = computedAt;
        this.barCount = barCount;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<IndicatorValue> find(IndicatorKind kind) {
        return Optional.ofNullable(values.get(kind));
    }

    /** The value if it was computed successfully. */
    public Optional<IndicatorValue> available(IndicatorKind kind) {
        return find(kind).filter(IndicatorValue::isAvailable);
    }

    /** Kinds that could not be computed, whether for lack of bars or because they failed. */
    public List<IndicatorKind> unavailableKinds() {
        return values.values().stream()
                .filter(v -> v.getStatus() != IndicatorStatus.OK)
                .map(IndicatorValue::getKind)
                .collect(Collectors.toList());
    }
}
