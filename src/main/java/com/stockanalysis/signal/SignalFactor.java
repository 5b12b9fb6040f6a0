package com.stockanalysis.signal;

/** Inputs weighed into a signal's confidence. */
public enum SignalFactor {
    TREND,
    MOMENTUM,
    MACD,
    /** Pull of the front-expiry max pain strike on the underlying. */
    MAX_PAIN
}
