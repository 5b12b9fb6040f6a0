package com.stockanalysis.domain.model;

import com.stockanalysis.domain.enums.OptionType;
import com.stockanalysis.domain.enums.StrikeType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** The option contract suggested for expressing a signal, with rough premium levels. */
@Value
@Builder
public class StrikeRecommendation {

    String tradingSymbol;
    BigDecimal strike;
    LocalDate expiry;
    OptionType optionType;
    StrikeType strikeType;
    long openInterest;

    /** False when no strike met the minimum open interest and the nearest one was used anyway. */
    boolean liquid;

    BigDecimal currentPremium;
    BigDecimal targetPremium;
    BigDecimal stopPremium;
}
