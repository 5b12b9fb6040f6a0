package com.stockanalysis.batch;

import com.stockanalysis.calendar.MarketHoursService;
import com.stockanalysis.domain.enums.FetchStatus;
import com.stockanalysis.domain.enums.MarketDataType;
import com.stockanalysis.domain.enums.ReportStatus;
import com.stockanalysis.domain.model.HistoricalRange;
import com.stockanalysis.domain.model.IndicatorSet;
import com.stockanalysis.domain.model.LiveQuote;
import com.stockanalysis.domain.model.OhlcvSeries;
import com.stockanalysis.domain.model.OptionChainSnapshot;
import com.stockanalysis.domain.model.Signal;
import com.stockanalysis.fetch.FetchBatchResult;
import com.stockanalysis.fetch.FetchOutcome;
import com.stockanalysis.fetch.FetchRequest;
import com.stockanalysis.fetch.FetchScheduler;
import com.stockanalysis.indicator.IndicatorPipeline;
import com.stockanalysis.option.OptionAnalysisConfig;
import com.stockanalysis.report.BatchSummary;
import com.stockanalysis.report.ReportSink;
import com.stockanalysis.report.SymbolReport;
import com.stockanalysis.signal.SignalAggregator;
import com.stockanalysis.signal.SignalInputs;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one analysis cycle over a watchlist.
 *
 * <p>A cycle has two phases. First every symbol's market data is requested through the
 * {@link FetchScheduler} in one batch, under a single deadline: history always, the option
 * chain when option analysis is enabled, and a live quote only while the market is open.
 * Then each symbol is computed on the analysis pool (indicators, then signal aggregation)
 * independently of the others. Every requested symbol gets exactly one {@link SymbolReport},
 * published to every {@link ReportSink}, followed by the {@link BatchSummary}.
 *
 * <p>Only one cycle runs at a time; a call that arrives while a cycle is in progress
 * returns empty.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final FetchScheduler fetchScheduler;
    private final IndicatorPipeline indicatorPipeline;
    private final SignalAggregator signalAggregator;
    private final MarketHoursService marketHoursService;
    private final List<ReportSink> reportSinks;
    private final ExecutorService analysisPool;
    private final BatchConfig batchConfig;
    private final OptionAnalysisConfig optionAnalysisConfig;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cycleSequence = new AtomicLong(0);

    public BatchOrchestrator(
            FetchScheduler fetchScheduler,
            IndicatorPipeline indicatorPipeline,
            SignalAggregator signalAggregator,
            MarketHoursService marketHoursService,
            List<ReportSink> reportSinks,
            @Qualifier("analysisPool") ExecutorService analysisPool,
            BatchConfig batchConfig,
            OptionAnalysisConfig optionAnalysisConfig,
            Clock clock) {
        this.fetchScheduler = fetchScheduler;
        this.indicatorPipeline = indicatorPipeline;
        this.signalAggregator = signalAggregator;
        this.marketHoursService = marketHoursService;
        this.reportSinks = List.copyOf(reportSinks);
        this.analysisPool = analysisPool;
        this.batchConfig = batchConfig;
        this.optionAnalysisConfig = optionAnalysisConfig;
        this.clock = clock;
    }

    /** Runs a cycle with the configured deadline. */
    public Optional<CycleResult> runCycle(Collection<String> symbols) {
        return runCycle(symbols, batchConfig.getDeadline());
    }

    /**
     * Runs a cycle whose fetch phase must finish within {@code deadline} from now. A zero
     * deadline makes no upstream calls and reports every symbol {@code TIMED_OUT}.
     */
    public Optional<CycleResult> runCycle(Collection<String> symbols, Duration deadline) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Analysis cycle already in progress, skipping request for {} symbols", symbols.size());
            return Optional.empty();
        }
        try {
            return Optional.of(doRunCycle(new ArrayList<>(new LinkedHashSet<>(symbols)), deadline));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CycleResult doRunCycle(List<String> symbols, Duration deadline) {
        long cycleId = cycleSequence.incrementAndGet();
        Instant startedAt = clock.instant();
        Instant deadlineAt = startedAt.plus(deadline.isNegative() ? Duration.ZERO : deadline);
        boolean marketOpen = marketHoursService.isMarketOpen();
        log.info(
                "Cycle {} starting: {} symbols, deadline {}, market {}",
                cycleId,
                symbols.size(),
                deadlineAt,
                marketOpen ? "open" : "closed");

        FetchBatchResult fetched = fetchScheduler.execute(buildRequests(symbols, marketOpen), deadlineAt);

        List<CompletableFuture<SymbolReport>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            Map<MarketDataType, FetchOutcome> outcomes = fetched.forSymbol(symbol);
            futures.add(CompletableFuture.supplyAsync(() -> computeSafely(cycleId, symbol, outcomes), analysisPool));
        }
        List<SymbolReport> reports = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());

        for (SymbolReport report : reports) {
            for (ReportSink sink : reportSinks) {
                try {
                    sink.publish(report);
                } catch (Exception e) {
                    log.error("Report sink {} failed for {}", sink.getClass().getSimpleName(), report.getSymbol(), e);
                }
            }
        }

        BatchSummary summary = BatchSummary.builder()
                .cycleId(cycleId)
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .deadline(deadlineAt)
                .symbolCount(symbols.size())
                .reportCounts(countByStatus(reports))
                .fetchCounts(fetched.countsByStatus())
                .rateLimitRejections(fetched.getRateLimitRejections())
                .transientFailures(fetched.getTransientFailures())
                .build();
        for (ReportSink sink : reportSinks) {
            try {
                sink.batchCompleted(summary);
            } catch (Exception e) {
                log.error("Report sink {} failed to complete cycle {}", sink.getClass().getSimpleName(), cycleId, e);
            }
        }

        log.info(
                "Cycle {} finished in {}ms: {} complete, {} degraded, {} timed out, {} unavailable",
                cycleId,
                summary.elapsed().toMillis(),
                summary.count(ReportStatus.COMPLETE),
                summary.count(ReportStatus.DEGRADED),
                summary.count(ReportStatus.TIMED_OUT),
                summary.count(ReportStatus.UNAVAILABLE));
        return new CycleResult(summary, reports);
    }

    List<FetchRequest> buildRequests(List<String> symbols, boolean marketOpen) {
        HistoricalRange range = HistoricalRange.lastDays(
                marketHoursService.today(), batchConfig.getHistoricalDays(), batchConfig.getHistoricalInterval());
        List<FetchRequest> requests = new ArrayList<>();
        for (String symbol : symbols) {
            if (marketOpen) {
                requests.add(FetchRequest.of(symbol, MarketDataType.QUOTE));
            }
            requests.add(FetchRequest.historical(symbol, range));
            if (optionAnalysisConfig.isEnabled()) {
                requests.add(FetchRequest.of(symbol, MarketDataType.OPTION_CHAIN));
            }
        }
        return requests;
    }

    private SymbolReport computeSafely(long cycleId, String symbol, Map<MarketDataType, FetchOutcome> outcomes) {
        try {
            return compute(cycleId, symbol, outcomes);
        } catch (Exception e) {
            log.error("Analysis failed for {} in cycle {}", symbol, cycleId, e);
            return SymbolReport.builder()
                    .symbol(symbol)
                    .cycleId(cycleId)
                    .status(ReportStatus.UNAVAILABLE)
                    .fetchStatuses(fetchStatuses(outcomes))
                    .message("Analysis failed: " + e.getMessage())
                    .build();
        }
    }

    SymbolReport compute(long cycleId, String symbol, Map<MarketDataType, FetchOutcome> outcomes) {
        FetchOutcome historyOutcome = outcomes.get(MarketDataType.HISTORICAL);
        Optional<OhlcvSeries> history = payload(historyOutcome, OhlcvSeries.class).filter(s -> !s.isEmpty());
        Optional<LiveQuote> quote = payload(outcomes.get(MarketDataType.QUOTE), LiveQuote.class);
        Optional<OptionChainSnapshot> chain = payload(outcomes.get(MarketDataType.OPTION_CHAIN), OptionChainSnapshot.class);

        BigDecimal price = quote.map(LiveQuote::getLastPrice)
                .filter(p -> p.signum() > 0)
                .orElseGet(() -> history.map(OhlcvSeries::lastClose).orElse(null));

        SymbolReport.SymbolReportBuilder report = SymbolReport.builder()
                .symbol(symbol)
                .cycleId(cycleId)
                .fetchStatuses(fetchStatuses(outcomes))
                .previousClose(previousClose(quote, history));

        boolean timedOut = outcomes.values().stream().anyMatch(o -> o.getStatus() == FetchStatus.TIMED_OUT);
        if (price == null) {
            String reason = historyOutcome != null && historyOutcome.getFailureReason() != null
                    ? historyOutcome.getFailureReason()
                    : "no price history";
            log.warn("No price for {} in cycle {}: {}", symbol, cycleId, reason);
            return report.status(timedOut ? ReportStatus.TIMED_OUT : ReportStatus.UNAVAILABLE)
                    .message(reason)
                    .build();
        }

        List<String> unavailable = new ArrayList<>();
        outcomes.forEach((type, outcome) -> {
            if (!outcome.isSucceeded()) {
                unavailable.add(type.name());
            }
        });
        if (historyOutcome != null && historyOutcome.isSucceeded() && history.isEmpty()) {
            unavailable.add(MarketDataType.HISTORICAL.name());
        }

        IndicatorSet indicators = history.map(indicatorPipeline::compute).orElse(null);
        Signal signal = signalAggregator.aggregate(SignalInputs.builder()
                .symbol(symbol)
                .cycleId(cycleId)
                .currentPrice(price)
                .indicators(indicators)
                .optionChain(chain.orElse(null))
                .unavailableInputs(unavailable)
                .build());

        return report.status(reportStatus(signal, timedOut)).signal(signal).build();
    }

    /** A timed-out fetch marks the report even when a partial signal could still be built. */
    private static ReportStatus reportStatus(Signal signal, boolean timedOut) {
        if (timedOut) {
            return ReportStatus.TIMED_OUT;
        }
        return signal.isDegraded() ? ReportStatus.DEGRADED : ReportStatus.COMPLETE;
    }

    private static <T> Optional<T> payload(FetchOutcome outcome, Class<T> type) {
        return outcome != null && outcome.isSucceeded() ? outcome.payloadAs(type) : Optional.empty();
    }

    private static BigDecimal previousClose(Optional<LiveQuote> quote, Optional<OhlcvSeries> history) {
        Optional<BigDecimal> fromQuote = quote.map(LiveQuote::getPreviousClose);
        if (fromQuote.isPresent()) {
            return fromQuote.get();
        }
        return history.filter(s -> s.size() >= 2)
                .map(s -> s.getCandles().get(s.size() - 2).getClose())
                .orElse(null);
    }

    private static Map<MarketDataType, FetchStatus> fetchStatuses(Map<MarketDataType, FetchOutcome> outcomes) {
        Map<MarketDataType, FetchStatus> statuses = new EnumMap<>(MarketDataType.class);
        outcomes.forEach((type, outcome) -> statuses.put(type, outcome.getStatus()));
        return statuses;
    }

    private static Map<ReportStatus, Long> countByStatus(List<SymbolReport> reports) {
        Map<ReportStatus, Long> counts = new EnumMap<>(ReportStatus.class);
        for (ReportStatus status : ReportStatus.values()) {
            counts.put(status, 0L);
        }
        reports.forEach(r -> counts.merge(r.getStatus(), 1L, Long::sum));
        return counts;
    }
}
