package com.stockanalysis.report;

/**
 * Destination for cycle results. Sinks are called from the orchestrator's thread, one
 * report per symbol followed by the summary; a failing sink must not affect the others.
 */
public interface ReportSink {

    void publish(SymbolReport report);

    default void batchCompleted(BatchSummary summary) {}
}
