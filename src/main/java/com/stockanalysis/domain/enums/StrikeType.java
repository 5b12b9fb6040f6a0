package com.stockanalysis.domain.enums;

/** Moneyness of a strike relative to the underlying's current price. */
public enum StrikeType {
    ATM,
    ITM,
    OTM
}
