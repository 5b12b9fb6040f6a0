package com.stockanalysis.indicator;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;

/**
 * Tunable parameters for one indicator (periods, scales, windows). Stored as a flexible
 * map so each calculator can read its own keys without a schema per indicator.
 */
@Data
public class IndicatorParams {

    private Map<String, Object> params = new HashMap<>();

    public static IndicatorParams empty() {
        return new IndicatorParams();
    }

    public static IndicatorParams of(Map<String, Object> values) {
        IndicatorParams indicatorParams = new IndicatorParams();
        indicatorParams.setParams(new HashMap<>(values));
        return indicatorParams;
    }

    public int getParamOrDefault(String key, int defaultValue) {
        Object value = params.get(key);
        return value != null ? Integer.parseInt(value.toString()) : defaultValue;
    }

    public double getDoubleParamOrDefault(String key, double defaultValue) {
        Object value = params.get(key);
        return value != null ? Double.parseDouble(value.toString()) : defaultValue;
    }
}
