package com.stockanalysis.report;

import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.ReportStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Totals for one finished cycle, published after every {@link SymbolReport}. */
@Value
@Builder
public class BatchSummary {

    long cycleId;
    Instant startedAt;
    Instant finishedAt;
    Instant deadline;
    int symbolCount;
    Map<ReportStatus, Long> reportCounts;
    Map<FetchStatus, Long> fetchCounts;
    int rateLimitRejections;
    int transientFailures;

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public long count(ReportStatus status) {
        return reportCounts.getOrDefault(status, 0L);
    }
}
