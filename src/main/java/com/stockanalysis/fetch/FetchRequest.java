package com.stockanalysis.fetch;

import com.stockanalysis.domain.enums.EndpointClass;
import com.stockanalysis.domain.enums.FetchPriority;
import com.stockanalysis.domain.enums.MarketDataType;
import com.stockanalysis.domain.model.HistoricalRange;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One unit of work for the fetch scheduler: a single data need for a single symbol.
 *
 * <p>Created by the batch orchestrator; the scheduler owns it for the rest of the cycle
 * and updates the retry bookkeeping as attempts fail. The sequence number is assigned on
 * first enqueue and preserved across retries, so a retried request keeps its place among
 * requests of the same priority.
 */
@Data
@Builder
public class FetchRequest {

    private String id;
    private String symbol;
    private MarketDataType dataType;
    private FetchPriority priority;

    /** Only set for {@link MarketDataType#HISTORICAL}. */
    private HistoricalRange range;

    /** Failed attempts so far. A request past the configured max is retired. */
    private int retryCount;

    /** Calls actually sent to the data source. */
    private int attempts;

    private Instant lastAttemptAt;
    private long sequenceNumber;

    public static FetchRequest of(String symbol, MarketDataType dataType) {
        return FetchRequest.builder()
                .id(symbol + ":" + dataType)
                .symbol(symbol)
                .dataType(dataType)
                .priority(dataType.getDefaultPriority())
                .build();
    }

    public static FetchRequest historical(String symbol, HistoricalRange range) {
        FetchRequest request = of(symbol, MarketDataType.HISTORICAL);
        request.setRange(range);
        return request;
    }

    public EndpointClass getEndpointClass() {
        return dataType.getEndpointClass();
    }
}
