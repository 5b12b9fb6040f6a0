package com.stockanalysis.report;

import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.MarketDataType;
import com.stockanalysis.domain.enums.ReportStatus;
import com.stockanalysis.domain.model.Signal;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of one cycle for one symbol. Exactly one is published per requested symbol,
 * whether or not a signal could be produced.
 */
@Value
@Builder
public class SymbolReport {

    String symbol;
    long cycleId;
    ReportStatus status;

    /** Null when no price was available; a {@link ReportStatus#TIMED_OUT} report may carry a partial signal. */
    Signal signal;

    BigDecimal previousClose;

    @Singular
    Map<MarketDataType, FetchStatus> fetchStatuses;

    /** Why no signal was produced, or null. */
    String message;

    public boolean producedSignal() {
        return signal != null;
    }
}
