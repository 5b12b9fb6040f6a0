package com.stockanalysis.fetch;

import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.MarketDataType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/** Everything a scheduler run produced: one outcome per submitted request, in submission order. */
@Getter
public class FetchBatchResult {

    private final List<FetchOutcome> outcomes;
    private final int rateLimitRejections;
    private final int transientFailures;

    public FetchBatchResult(List<FetchOutcome> outcomes, int rateLimitRejections, int transientFailures) {
        this.outcomes = List.copyOf(outcomes);
        this.rateLimitRejections = rateLimitRejections;
        this.transientFailures = transientFailures;
    }

    /** Outcomes for one symbol keyed by data type. */
    public Map<MarketDataType, FetchOutcome> forSymbol(String symbol) {
        Map<MarketDataType, FetchOutcome> bySymbol = new EnumMap<>(MarketDataType.class);
        for (FetchOutcome outcome : outcomes) {
            if (outcome.getSymbol().equals(symbol)) {
                bySymbol.put(outcome.getDataType(), outcome);
            }
        }
        return bySymbol;
    }

    public long count(FetchStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public Map<FetchStatus, Long> countsByStatus() {
        return outcomes.stream().collect(Collectors.groupingBy(FetchOutcome::getStatus, Collectors.counting()));
    }
}
