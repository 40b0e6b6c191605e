package com.candlegate.ingest.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @Nested
    @DisplayName("Built-in defaults")
    class Defaults {

        @Test
        void collectionDefaults() {
            PipelineConfig config = ConfigLoader.defaults();

            assertEquals("okx", config.exchangeId());
            assertEquals("15min", config.interval());
            assertEquals(List.of("BTC/USDT"), config.symbols());

            var api = config.collection().api();
            assertEquals(100, api.rateLimit());
            assertEquals(3, api.retries());
            assertEquals(1.0, api.backoffBase());
            assertEquals(1000, api.maxRowsPerRequest());
            assertEquals(4, config.collection().maxConcurrentSymbols());
        }

        @Test
        void validationDefaults() {
            var validation = ConfigLoader.defaults().validation();

            assertEquals(0.05, validation.missingThreshold());
            assertFalse(validation.strictOhlc());
            assertEquals(15, validation.gapFill().shortGap());
            assertEquals(0.2, validation.outliers().priceJump());
            assertEquals(5.0, validation.outliers().volumeSpike());
            assertEquals(96, validation.outliers().rollingWindow());
            assertEquals(0, validation.outliers().forcedMinimum(), "Forced outliers must be opt-in");
        }

        @Test
        void storageRootDefaultsUnderUserHome() {
            Path root = ConfigLoader.defaults().storage().rootPath();

            assertTrue(root.endsWith(Path.of(".candlegate", "data")), "Unexpected default root " + root);
        }
    }

    @Nested
    @DisplayName("User overrides")
    class Overrides {

        @Test
        @DisplayName("Nested keys merge over defaults one by one")
        void deepMerge() throws Exception {
            PipelineConfig config = ConfigLoader.fromYaml("""
                data_validation:
                  missing_threshold: 0.1
                  outliers:
                    rolling_window: 20
                """);

            assertEquals(0.1, config.validation().missingThreshold());
            assertEquals(20, config.validation().outliers().rollingWindow());
            assertEquals(0.2, config.validation().outliers().priceJump());
            assertEquals(15, config.validation().gapFill().shortGap());
            assertEquals(3, config.collection().api().retries());
        }

        @Test
        @DisplayName("Lists replace rather than append")
        void listsReplace() throws Exception {
            PipelineConfig config = ConfigLoader.fromYaml("symbols: [ETH/USDT, SOL/USDT]");

            assertEquals(List.of("ETH/USDT", "SOL/USDT"), config.symbols());
        }

        @Test
        @DisplayName("Unknown keys are ignored")
        void unknownKeys() throws Exception {
            PipelineConfig config = ConfigLoader.fromYaml("""
                model_training: { epochs: 10 }
                data_collection:
                  api: { retries: 5, user_agent: test }
                """);

            assertEquals(5, config.collection().api().retries());
        }

        @Test
        void loadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("candlegate.yaml");
            Files.writeString(file, """
                interval: 1h
                storage:
                  root: %s
                """.formatted(dir.resolve("data")));

            PipelineConfig config = ConfigLoader.load(file);

            assertEquals("1h", config.interval());
            assertEquals(dir.resolve("data"), config.storage().rootPath());
        }

        @Test
        void missingFile(@TempDir Path dir) {
            assertThrows(IOException.class, () -> ConfigLoader.load(dir.resolve("absent.yaml")));
        }

        @Test
        void storageRootOverride() {
            PipelineConfig config = ConfigLoader.defaults().withStorageRoot(Path.of("/tmp/candles"));

            assertEquals(Path.of("/tmp/candles"), config.storage().rootPath());
            assertEquals("csv", config.storage().format());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsZeroRetries() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.fromYaml("data_collection: { api: { retries: 0 } }"));
            assertTrue(e.getMessage().contains("retries"));
        }

        @Test
        void rejectsThresholdAboveOne() {
            assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.fromYaml("data_validation: { missing_threshold: 1.5 }"));
        }

        @Test
        void rejectsUnknownInterval() {
            assertThrows(IllegalArgumentException.class, () -> ConfigLoader.fromYaml("interval: 1M"));
        }

        @Test
        void rejectsUnsupportedStorageFormat() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.fromYaml("storage: { format: parquet }"));
            assertTrue(e.getMessage().contains("storage.format"));
        }

        @Test
        void acceptsCsvInAnyCase() throws Exception {
            assertEquals("CSV", ConfigLoader.fromYaml("storage: { format: CSV }").storage().format());
        }

        @Test
        void rejectsNegativeForcedMinimum() {
            assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.fromYaml("data_validation: { outliers: { forced_minimum: -1 } }"));
        }
    }
}
