package com.stockanalysis.domain.model;

import com.stockanalysis.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A single option contract (one strike, one expiry, CE or PE) as seen at snapshot time.
 */
@Value
@Builder
public class OptionContract {

    String tradingSymbol;
    BigDecimal strike;
    LocalDate expiry;
    OptionType optionType;

    /** Open interest: outstanding contracts. */
    long openInterest;

    /** Annualized implied volatility in percent (e.g. 18.5). Null when it could not be solved. */
    Double impliedVolatility;

    BigDecimal lastPrice;
    long volume;
}
