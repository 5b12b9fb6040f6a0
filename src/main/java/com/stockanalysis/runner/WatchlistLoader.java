package com.stockanalysis.runner;

import com.stockanalysis.batch.BatchConfig;
import com.stockanalysis.exception.InvalidConfigurationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the watchlist for a cycle.
 *
 * <p>Symbols come from {@code analysis.batch.symbols-file} when set, otherwise from
 * {@code analysis.batch.symbols}. Entries such as {@code NSE:RELIANCE} or
 * {@code RELIANCE-EQ} are reduced to the bare trading symbol; anything that is not a
 * plausible NSE symbol afterwards is dropped with a warning. Duplicates keep their first
 * position. {@code skip} and {@code limit} are applied last.
 */
@Component
public class WatchlistLoader {

    private static final Logger log = LoggerFactory.getLogger(WatchlistLoader.class);

    private static final Pattern SYMBOL = Pattern.compile("^[A-Z0-9&]{2,20}$");

    private final BatchConfig batchConfig;

    public WatchlistLoader(BatchConfig batchConfig) {
        this.batchConfig = batchConfig;
    }

    public List<String> load() {
        List<String> raw;
        String file = batchConfig.getSymbolsFile();
        if (file != null && !file.isBlank()) {
            raw = readFile(Paths.get(file));
        } else {
            raw = batchConfig.getSymbols();
        }
        List<String> symbols = normalize(raw);
        int from = Math.min(batchConfig.getSkip(), symbols.size());
        int to = batchConfig.getLimit() != null ? Math.min(symbols.size(), from + batchConfig.getLimit()) : symbols.size();
        List<String> selected = new ArrayList<>(symbols.subList(from, to));
        log.info("Watchlist: {} symbols{}", selected.size(), file != null && !file.isBlank() ? " from " + file : "");
        return selected;
    }

    /** Comma-separated when the content has a comma, otherwise one symbol per line. */
    List<String> readFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new InvalidConfigurationException("analysis.batch.symbols-file", path, "cannot be read: " + e.getMessage());
        }
        if (content.isEmpty()) {
            return List.of();
        }
        String[] entries = content.contains(",") ? content.split(",") : content.split("\\R");
        return Arrays.asList(entries);
    }

    List<String> normalize(List<String> entries) {
        Set<String> symbols = new LinkedHashSet<>();
        for (String entry : entries) {
            String symbol = clean(entry);
            if (symbol.isEmpty()) {
                continue;
            }
            if (!SYMBOL.matcher(symbol).matches()) {
                log.warn("Ignoring invalid symbol '{}'", entry.strip());
                continue;
            }
            symbols.add(symbol);
        }
        return new ArrayList<>(symbols);
    }

    private static String clean(String entry) {
        if (entry == null) {
            return "";
        }
        String symbol = entry.strip().toUpperCase(Locale.ROOT);
        int colon = symbol.indexOf(':');
        if (colon >= 0) {
            symbol = symbol.substring(colon + 1);
        }
        int dash = symbol.indexOf('-');
        if (dash >= 0) {
            symbol = symbol.substring(0, dash);
        }
        return symbol.strip();
    }
}
