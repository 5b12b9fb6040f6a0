package com.stockanalysis.indicator;

import com.stockanalysis.domain.enums.IndicatorKind;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-indicator parameters bound from {@code analysis.indicators.*}, e.g.
 * {@code analysis.indicators.params.MOMENTUM.rsiPeriod=14}. Anything not configured
 * falls back to the calculator's defaults.
 */
@Data
@Component
@ConfigurationProperties(prefix = "analysis.indicators")
public class IndicatorConfig {

    /** Exchange time zone used to stamp bars handed to ta4j. */
    private String timezone = "Asia/Kolkata";

    private Map<IndicatorKind, Map<String, Object>> params = new EnumMap<>(IndicatorKind.class);

    public IndicatorParams paramsFor(IndicatorKind kind) {
        Map<String, Object> values = params.get(kind);
        return values != null ? IndicatorParams.of(values) : IndicatorParams.empty();
    }
}
