package com.stockanalysis.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Broker API endpoint families that carry their own call quota.
 * Kite Connect meters historical candles, quotes and order placement separately;
 * option chains are assembled from quote calls on the derivatives segment and are
 * budgeted on their own so a large chain cannot starve spot quotes.
 */
@Getter
@RequiredArgsConstructor
public enum EndpointClass {
    QUOTE("Live quote / LTP"),
    OPTION_CHAIN("Option chain quotes"),
    HISTORICAL("Historical candles"),
    ORDER("Order placement and modification"),
    OTHER("Instruments, profile and everything else");

    private final String description;
}
