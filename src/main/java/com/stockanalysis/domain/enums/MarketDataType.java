package com.stockanalysis.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** The kinds of market data the orchestrator requests per symbol. */
@Getter
@RequiredArgsConstructor
public enum MarketDataType {
    QUOTE(EndpointClass.QUOTE, FetchPriority.HIGH),
    OPTION_CHAIN(EndpointClass.OPTION_CHAIN, FetchPriority.MEDIUM),
    HISTORICAL(EndpointClass.HISTORICAL, FetchPriority.LOW);

    private final EndpointClass endpointClass;
    private final FetchPriority defaultPriority;
}
