package com.stockanalysis.domain.enums;

/** Per-symbol outcome of one analysis cycle. */
public enum ReportStatus {
    COMPLETE,
    DEGRADED,
    TIMED_OUT,
    UNAVAILABLE
}
