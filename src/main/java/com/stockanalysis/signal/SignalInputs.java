package com.stockanalysis.signal;

import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.OptionChainSnapshot;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Everything the aggregator needs for one symbol. Optional parts may be null. */
@Value
@Builder
public class SignalInputs {

    String symbol;
    long cycleId;
    BigDecimal currentPrice;

    /** Null when no history could be fetched. */
    IndicatorSet indicators;

    /** Null when option chains are disabled or the fetch failed. */
    OptionChainSnapshot optionChain;

    /** Data types whose fetch failed or timed out, e.g. "OPTION_CHAIN". */
    @Singular
    List<String> unavailableInputs;
}
