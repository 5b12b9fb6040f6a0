package com.stockanalysis.domain.enums;

public enum IndicatorStatus {
    OK,
    /** Series shorter than the indicator's lookback. Not an error. */
    INSUFFICIENT_DATA,
    /** The calculation threw; only this indicator is affected. */
    FAILED
}
