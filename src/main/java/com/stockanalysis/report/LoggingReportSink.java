package com.stockanalysis.report;

import com.stockanalysis.domain.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** One log line per symbol and per cycle, for operators watching the console. */
@Component
public class LoggingReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingReportSink.class);

    @Override
    public void publish(SymbolReport report) {
        if (!report.producedSignal()) {
            log.info("[cycle {}] {} {}: {}", report.getCycleId(), report.getSymbol(), report.getStatus(), report.getMessage());
            return;
        }
        Signal signal = report.getSignal();
        log.info(
                "[cycle {}] {} {} {} {}% price={} target={} stop={} days={}",
                report.getCycleId(),
                report.getSymbol(),
                report.getStatus(),
                signal.getDirection(),
                Math.round(signal.getConfidence() * 100),
                signal.getCurrentPrice(),
                signal.getTargetPrice(),
                signal.getStopLoss(),
                signal.getDaysToTarget());
    }

    @Override
    public void batchCompleted(BatchSummary summary) {
        log.info(
                "[cycle {}] {} symbols in {}s, reports {}, fetches {}, rate limited {} times",
                summary.getCycleId(),
                summary.getSymbolCount(),
                summary.elapsed().toSeconds(),
                summary.getReportCounts(),
                summary.getFetchCounts(),
                summary.getRateLimitRejections());
    }
}
