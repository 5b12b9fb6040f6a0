package com.stockanalysis.unit.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stockanalysis.batch.BatchConfig;
import com.stockanalysis.exception.InvalidConfigurationException;
import com.stockanalysis.runner.WatchlistLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WatchlistLoaderTest {

    @TempDir
    Path tempDir;

    private BatchConfig batchConfig;
    private WatchlistLoader loader;

    @BeforeEach
    void setUp() {
        batchConfig = new BatchConfig();
        loader = new WatchlistLoader(batchConfig);
    }

    @Nested
    @DisplayName("Configured list")
    class ConfiguredList {

        @Test
        @DisplayName("The default watchlist loads as configured")
        void defaults() {
            assertThat(loader.load()).hasSize(10).startsWith("RELIANCE", "TCS");
        }

        @Test
        @DisplayName("Exchange prefixes and series suffixes are stripped, duplicates and junk dropped")
        void normalizes() {
            batchConfig.setSymbols(List.of("NSE:reliance", " tcs-EQ ", "M&M", "TCS", "not a symbol", "", "X"));

            assertThat(loader.load()).containsExactly("RELIANCE", "TCS", "M&M");
        }

        @Test
        @DisplayName("Skip and limit select a window of the list")
        void skipAndLimit() {
            batchConfig.setSymbols(List.of("AAA", "BBB", "CCC", "DDD", "EEE"));
            batchConfig.setSkip(1);
            batchConfig.setLimit(2);

            assertThat(loader.load()).containsExactly("BBB", "CCC");
        }

        @Test
        @DisplayName("Skipping past the end gives an empty list")
        void skipPastEnd() {
            batchConfig.setSymbols(List.of("AAA", "BBB"));
            batchConfig.setSkip(5);

            assertThat(loader.load()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Symbols file")
    class SymbolsFile {

        @Test
        @DisplayName("A comma-separated file takes precedence over the configured list")
        void commaSeparated() throws IOException {
            Path file = Files.writeString(tempDir.resolve("symbols.txt"), "INFY, wipro ,NSE:SBIN\n");
            batchConfig.setSymbolsFile(file.toString());

            assertThat(loader.load()).containsExactly("INFY", "WIPRO", "SBIN");
        }

        @Test
        @DisplayName("A file without commas is read one symbol per line")
        void linePerSymbol() throws IOException {
            Path file = Files.writeString(tempDir.resolve("symbols.txt"), "INFY\r\nITC\n\nHDFCBANK\n");
            batchConfig.setSymbolsFile(file.toString());

            assertThat(loader.load()).containsExactly("INFY", "ITC", "HDFCBANK");
        }

        @Test
        @DisplayName("An empty file is an empty watchlist")
        void emptyFile() throws IOException {
            Path file = Files.writeString(tempDir.resolve("symbols.txt"), "  \n");
            batchConfig.setSymbolsFile(file.toString());

            assertThat(loader.load()).isEmpty();
        }

        @Test
        @DisplayName("A missing file is a configuration error")
        void missingFile() {
            batchConfig.setSymbolsFile(tempDir.resolve("absent.txt").toString());

            assertThatThrownBy(() -> loader.load())
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("absent.txt");
        }
    }
}
