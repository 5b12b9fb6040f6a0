package com.stockanalysis.exception;

import java.util.Map;

/**
 * A market data call failed for a reason other than rate limiting: network trouble,
 * a broker-side error, an unknown instrument. The fetch scheduler treats it as a
 * transient failure and retries with backoff.
 */
public class MarketDataException extends BaseException {

    public MarketDataException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }

    protected MarketDataException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
