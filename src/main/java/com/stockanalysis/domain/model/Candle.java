package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One OHLCV bar. Timestamps are exchange-local (IST) and mark the start of the bar.
 * Prices use {@link BigDecimal} so values read from the broker survive unchanged
 * into reports; indicator maths converts to double at the ta4j boundary.
 */
@Value
@Builder
public class Candle {

    LocalDateTime timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;
}
