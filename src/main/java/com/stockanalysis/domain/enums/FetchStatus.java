package com.stockanalysis.domain.enums;

public enum FetchStatus {
    SUCCEEDED,
    /** Retries exhausted; the data will not arrive this cycle. */
    UNAVAILABLE,
    /** Abandoned because the batch deadline passed. */
    TIMED_OUT
}
