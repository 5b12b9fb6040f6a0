package com.stockanalysis.batch;

import com.stockanalysis.report.BatchSummary;
import com.stockanalysis.report.SymbolReport;
import java.util.List;
import java.util.Optional;

/** Everything one cycle published, reports in watchlist order. */
public record CycleResult(BatchSummary summary, List<SymbolReport> reports) {

    public Optional<SymbolReport> report(String symbol) {
        return reports.stream().filter(r -> r.getSymbol().equals(symbol)).findFirst();
    }
}
