package com.stockanalysis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Metrics derived from one option chain snapshot. Fields that cannot be derived (empty
 * chain, no IV data) are null and {@code reducedConfidence} is set with the reasons.
 */
@Value
@Builder
public class OptionAnalysis {

    String symbol;
    BigDecimal spotPrice;

    /** Expiry used for max pain and open interest figures (the nearest one). */
    LocalDate frontExpiry;

    int expiryCount;
    int contractCount;

    BigDecimal atmStrike;

    /** Mean IV of the ATM contracts, in percent. */
    Double atmIv;

    /** Rank of the ATM IV within the chain's IV distribution, 0..100. */
    Double ivPercentile;

    BigDecimal maxPain;

    BigDecimal maxCallOiStrike;
    BigDecimal maxPutOiStrike;

    @Singular
    List<BigDecimal> highOiStrikes;

    /** Total put OI / total call OI on the front expiry. */
    Double putCallOiRatio;

    boolean reducedConfidence;

    @Singular
    List<String> reasons;

    public boolean isEmptyChain() {
        return contractCount == 0;
    }
}
