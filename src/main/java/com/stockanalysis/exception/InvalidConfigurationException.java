package com.stockanalysis.exception;

import java.util.Map;

/**
 * A configured value is unusable. Raised while beans are being constructed so the
 * application refuses to start instead of running with a broken quota or weight table.
 */
public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public InvalidConfigurationException(String property, Object value, String reason) {
        super(
                ErrorCode.CONFIGURATION_ERROR,
                "Invalid value for " + property + " (" + value + "): " + reason,
                Map.of("property", property));
    }
}
