package com.stockanalysis.runner;

import com.stockanalysis.batch.BatchConfig;
import com.stockanalysis.batch.BatchOrchestrator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Runs one cycle over the watchlist right after startup when {@code analysis.batch.run-on-startup} is set. */
@Component
public class AnalysisRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

    private final BatchOrchestrator batchOrchestrator;
    private final WatchlistLoader watchlistLoader;
    private final BatchConfig batchConfig;

    public AnalysisRunner(BatchOrchestrator batchOrchestrator, WatchlistLoader watchlistLoader, BatchConfig batchConfig) {
        this.batchOrchestrator = batchOrchestrator;
        this.watchlistLoader = watchlistLoader;
        this.batchConfig = batchConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!batchConfig.isRunOnStartup()) {
            log.info("Startup analysis disabled");
            return;
        }
        List<String> symbols = watchlistLoader.load();
        if (symbols.isEmpty()) {
            log.warn("Watchlist is empty, nothing to analyze");
            return;
        }
        batchOrchestrator.runCycle(symbols);
    }
}
