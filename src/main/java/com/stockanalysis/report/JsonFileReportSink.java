package com.stockanalysis.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stockanalysis.exception.ReportWriteException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one JSON document per cycle into {@code analysis.output.directory}.
 *
 * <p>Reports are buffered per cycle as they arrive and written when the cycle's summary
 * comes in. The file is written to a temporary name first and then moved into place so a
 * reader never sees a half-written report.
 */
@Component
public class JsonFileReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReportSink.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String FORMAT_VERSION = "1.0.0";

    private final OutputConfig outputConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final SignalReportMapper signalReportMapper = Mappers.getMapper(SignalReportMapper.class);

    /** Key = cycle id. */
    private final Map<Long, List<SymbolReport>> pending = new ConcurrentHashMap<>();

    public JsonFileReportSink(OutputConfig outputConfig, Clock clock) {
        this.outputConfig = outputConfig;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (outputConfig.isPrettyPrint()) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    @Override
    public void publish(SymbolReport report) {
        if (!outputConfig.isJsonEnabled()) {
            return;
        }
        pending.computeIfAbsent(report.getCycleId(), id -> new CopyOnWriteArrayList<>()).add(report);
    }

    @Override
    public void batchCompleted(BatchSummary summary) {
        List<SymbolReport> reports = pending.remove(summary.getCycleId());
        if (!outputConfig.isJsonEnabled()) {
            return;
        }
        List<SymbolReport> ordered = reports != null ? new ArrayList<>(reports) : new ArrayList<>();
        ordered.sort(Comparator.comparing(SymbolReport::getSymbol));
        Path file = write(summary, ordered);
        log.info("Wrote {} symbol reports for cycle {} to {}", ordered.size(), summary.getCycleId(), file);
    }

    Path write(BatchSummary summary, List<SymbolReport> reports) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata(summary));
        document.put("stocks", signalReportMapper.toRows(reports));

        Path directory = Paths.get(outputConfig.getDirectory());
        String name = outputConfig.getFilePrefix() + "_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP)
                + "_" + summary.getCycleId() + ".json";
        Path target = directory.resolve(name);
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ReportWriteException("Failed to serialize report for cycle " + summary.getCycleId(), e);
        }

        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, name, ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            ReportWriteException failure = new ReportWriteException("Failed to write report " + target, e);
            if (temp != null) {
                discard(temp, failure);
            }
            throw failure;
        }
    }

    private static void discard(Path temp, ReportWriteException failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private Map<String, Object> metadata(BatchSummary summary) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", FORMAT_VERSION);
        metadata.put("cycleId", summary.getCycleId());
        metadata.put("startedAt", summary.getStartedAt());
        metadata.put("finishedAt", summary.getFinishedAt());
        metadata.put("symbolCount", summary.getSymbolCount());
        metadata.put("reportCounts", summary.getReportCounts());
        metadata.put("fetchCounts", summary.getFetchCounts());
        metadata.put("rateLimitRejections", summary.getRateLimitRejections());
        return metadata;
    }
}
