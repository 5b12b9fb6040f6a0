package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LiveQuote {

    String symbol;
    BigDecimal lastPrice;

    /** Previous session close; null when the broker did not send OHLC. */
    BigDecimal previousClose;

    long volume;
    LocalDateTime timestamp;
}
