package com.stockanalysis.quota;

import com.stockanalysis.domain.enums.EndpointClass;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Per endpoint class call budgets, bound from {@code analysis.quota.*}.
 *
 * <p>Defaults follow the Kite Connect published limits with headroom: historical candles
 * are by far the tightest budget, so they get 3 calls per minute.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.quota")
public class QuotaProperties {

    /** Length of one quota window. Windows are aligned to the epoch. */
    @NotNull
    private Duration window = Duration.ofMinutes(1);

    /** Floor applied to any server-suggested retry delay after a rate-limit rejection. */
    @NotNull
    private Duration minRetryDelay = Duration.ofSeconds(60);

    @NotEmpty
    private Map<EndpointClass, Integer> limits = defaultLimits();

    @AssertTrue(message = "window and min-retry-delay must be positive")
    public boolean isDurationsPositive() {
        return window != null
                && !window.isNegative()
                && !window.isZero()
                && minRetryDelay != null
                && !minRetryDelay.isNegative();
    }

    @AssertTrue(message = "every endpoint class needs a positive call limit")
    public boolean isLimitsComplete() {
        if (limits == null) {
            return false;
        }
        for (EndpointClass endpointClass : EndpointClass.values()) {
            Integer limit = limits.get(endpointClass);
            if (limit == null || limit <= 0) {
                return false;
            }
        }
        return true;
    }

    private static Map<EndpointClass, Integer> defaultLimits() {
        Map<EndpointClass, Integer> limits = new EnumMap<>(EndpointClass.class);
        limits.put(EndpointClass.QUOTE, 60);
        limits.put(EndpointClass.OPTION_CHAIN, 10);
        limits.put(EndpointClass.HISTORICAL, 3);
        limits.put(EndpointClass.ORDER, 200);
        limits.put(EndpointClass.OTHER, 200);
        return limits;
    }
}
