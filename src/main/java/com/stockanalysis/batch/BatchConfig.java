package com.stockanalysis.batch;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/** Watchlist and cycle settings, bound from {@code analysis.batch.*}. */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "analysis.batch")
public class BatchConfig {

    /** Watchlist used when no symbols file is configured. */
    private List<String> symbols = new ArrayList<>(List.of(
            "RELIANCE", "TCS", "HDFCBANK", "INFY", "ICICIBANK", "SBIN", "HDFC", "HINDUNILVR", "BHARTIARTL", "ITC"));

    /** Optional file with comma- or line-separated symbols; takes precedence over {@link #symbols}. */
    private String symbolsFile;

    /** Wall-clock budget for the fetch phase of one cycle. */
    @NotNull
    private Duration deadline = Duration.ofMinutes(30);

    /** Leading watchlist entries to skip. */
    @Min(0)
    private int skip = 0;

    /** Maximum number of symbols per cycle after skipping; null for no limit. */
    @Min(1)
    private Integer limit;

    private boolean runOnStartup = true;

    /** Symbols computed in parallel once their data is in. */
    @Min(1)
    private int computeParallelism = 4;

    @Min(1)
    private int historicalDays = 365;

    @NotBlank
    private String historicalInterval = "day";
}
