package com.stockanalysis.runner;

import com.stockanalysis.batch.BatchOrchestrator;
import com.stockanalysis.calendar.MarketHoursService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-runs the analysis cycle on a market-aware cadence.
 *
 * <p>Polls every 5 seconds and starts a cycle once the interval since the previous start
 * has elapsed: {@code market-open-interval} while the market is open,
 * {@code market-closed-interval} otherwise. The first poll after startup waits one full
 * interval, since {@link AnalysisRunner} already covers the startup run.
 */
@Component
public class PeriodicAnalysisJob {

    private static final Logger log = LoggerFactory.getLogger(PeriodicAnalysisJob.class);

    private final BatchOrchestrator batchOrchestrator;
    private final WatchlistLoader watchlistLoader;
    private final MarketHoursService marketHoursService;
    private final PeriodicAnalysisConfig periodicAnalysisConfig;
    private final Clock clock;

    private volatile Instant lastStart;

    public PeriodicAnalysisJob(
            BatchOrchestrator batchOrchestrator,
            WatchlistLoader watchlistLoader,
            MarketHoursService marketHoursService,
            PeriodicAnalysisConfig periodicAnalysisConfig,
            Clock clock) {
        this.batchOrchestrator = batchOrchestrator;
        this.watchlistLoader = watchlistLoader;
        this.marketHoursService = marketHoursService;
        this.periodicAnalysisConfig = periodicAnalysisConfig;
        this.clock = clock;
        this.lastStart = clock.instant();
    }

    @Scheduled(fixedDelay = 5000, initialDelay = 5000)
    public void poll() {
        if (!periodicAnalysisConfig.isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        if (!isDue(now)) {
            return;
        }
        lastStart = now;
        List<String> symbols = watchlistLoader.load();
        log.info("Periodic analysis starting for {} symbols", symbols.size());
        batchOrchestrator.runCycle(symbols);
    }

    boolean isDue(Instant now) {
        Duration interval = marketHoursService.isMarketOpen()
                ? periodicAnalysisConfig.getMarketOpenInterval()
                : periodicAnalysisConfig.getMarketClosedInterval();
        return !now.isBefore(lastStart.plus(interval));
    }
}
