package com.stockanalysis.domain.enums;

public enum SignalStatus {
    COMPLETE,
    /** Produced with one or more inputs missing or insufficient. */
    DEGRADED
}
