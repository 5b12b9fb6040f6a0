package com.stockanalysis.fetch;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Fetch scheduler tunables, bound from {@code analysis.fetch.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.fetch")
public class FetchSchedulerConfig {

    /** Concurrent upstream calls. Also the size of the worker pool. */
    @Min(1)
    private int workerPoolSize = 4;

    /** Retries after the first attempt before a request is reported unavailable. */
    @Min(0)
    private int maxRetries = 3;

    /** First backoff interval after a transient failure. */
    @NotNull
    private Duration retryBackoffFloor = Duration.ofSeconds(5);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull
    private Duration maxBackoff = Duration.ofMinutes(5);
}
