package com.stockanalysis.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", false),
    BROKER_ERROR("BROKER_ERROR", true),
    RATE_LIMITED("RATE_LIMITED", true),
    REPORT_WRITE_FAILED("REPORT_WRITE_FAILED", false);

    private final String code;

    /** Whether a fetch failing with this code may be retried by the scheduler. */
    private final boolean retryable;
}
