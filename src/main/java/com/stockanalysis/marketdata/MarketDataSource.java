package com.stockanalysis.marketdata;

import com.stockanalysis.domain.model.HistoricalRange;
import com.stockanalysis.domain.model.LiveQuote;
import com.stockanalysis.domain.model.OhlcvSeries;
import com.stockanalysis.domain.model.OptionChainSnapshot;

/**
 * Broker-agnostic market data contract used by the fetch scheduler.
 *
 * <p>Implementations make exactly one upstream call per method invocation and do not
 * retry or throttle on their own; quota accounting and retries belong to the scheduler.
 * A rate-limit response must surface as {@link com.stockanalysis.exception.RateLimitException}
 * and any other failure as {@link com.stockanalysis.exception.MarketDataException}.
 */
public interface MarketDataSource {

    OhlcvSeries fetchHistorical(String symbol, HistoricalRange range);

    OptionChainSnapshot fetchOptionChain(String symbol);

    LiveQuote fetchQuote(String symbol);
}
