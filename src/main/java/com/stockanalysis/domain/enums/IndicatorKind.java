package com.stockanalysis.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Indicators produced by the pipeline, in the order they are computed. */
@Getter
@RequiredArgsConstructor
public enum IndicatorKind {
    TREND(true),
    MOMENTUM(true),
    MACD(true),
    SUPPORT_RESISTANCE(false),
    VOLATILITY(false),
    ADX(false),
    VOLUME_CHANGE(false);

    /** Whether the indicator casts a direction vote. */
    private final boolean directional;
}
