package com.stockanalysis.report;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Report output settings, bound from {@code analysis.output.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.output")
public class OutputConfig {

    @NotBlank
    private String directory = "output";

    /** File names are {@code <prefix>_<yyyyMMdd_HHmmss>.json}. */
    @NotBlank
    private String filePrefix = "stock_analysis";

    private boolean jsonEnabled = true;

    private boolean prettyPrint = true;
}
