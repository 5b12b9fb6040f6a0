package com.stockanalysis.runner;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Repeat schedule, bound from {@code analysis.periodic.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.periodic")
public class PeriodicAnalysisConfig {

    private boolean enabled = false;

    @NotNull
    private Duration marketOpenInterval = Duration.ofSeconds(60);

    @NotNull
    private Duration marketClosedInterval = Duration.ofHours(1);
}
