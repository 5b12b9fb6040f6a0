package com.stockanalysis.unit.runner;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.stockanalysis.batch.BatchOrchestrator;
import com.stockanalysis.calendar.MarketHoursService;
import com.stockanalysis.runner.PeriodicAnalysisConfig;
import com.stockanalysis.runner.PeriodicAnalysisJob;
import com.stockanalysis.runner.WatchlistLoader;
import com.stockanalysis.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PeriodicAnalysisJobTest {

    @Mock
    private BatchOrchestrator batchOrchestrator;

    @Mock
    private WatchlistLoader watchlistLoader;

    @Mock
    private MarketHoursService marketHoursService;

    private PeriodicAnalysisConfig config;
    private MutableClock clock;
    private PeriodicAnalysisJob job;

    @BeforeEach
    void setUp() {
        config = new PeriodicAnalysisConfig();
        config.setEnabled(true);
        clock = new MutableClock(Instant.parse("2026-01-05T04:00:00Z"));
        job = new PeriodicAnalysisJob(batchOrchestrator, watchlistLoader, marketHoursService, config, clock);
    }

    @Test
    @DisplayName("Disabled job never runs")
    void disabled() {
        config.setEnabled(false);
        clock.advance(Duration.ofDays(1));

        job.poll();

        verifyNoInteractions(batchOrchestrator, watchlistLoader, marketHoursService);
    }

    @Test
    @DisplayName("While the market is open a cycle starts once the open interval has passed")
    void openInterval() {
        when(marketHoursService.isMarketOpen()).thenReturn(true);
        when(watchlistLoader.load()).thenReturn(List.of("INFY"));

        clock.advance(Duration.ofSeconds(30));
        job.poll();
        verify(batchOrchestrator, never()).runCycle(List.of("INFY"));

        clock.advance(Duration.ofSeconds(30));
        job.poll();
        verify(batchOrchestrator).runCycle(List.of("INFY"));
    }

    @Test
    @DisplayName("While the market is closed the longer interval applies")
    void closedInterval() {
        when(marketHoursService.isMarketOpen()).thenReturn(false);

        clock.advance(Duration.ofMinutes(59));
        job.poll();

        verifyNoInteractions(batchOrchestrator, watchlistLoader);
    }
}
