package com.candlegate.ingest.store;

import com.candlegate.core.exception.EmptyDataException;
import com.candlegate.core.model.Bar;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.Manifest;
import com.candlegate.core.model.PartitionEntry;
import com.candlegate.core.model.Provenance;
import com.candlegate.core.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.candlegate.ingest.TestBars.SYMBOL;
import static com.candlegate.ingest.TestBars.T0;
import static com.candlegate.ingest.TestBars.barSeries;
import static org.junit.jupiter.api.Assertions.*;

class PartitionedStoreTest {

    private static final Interval FIFTEEN = Interval.parse("15min");
    private static final long STEP = FIFTEEN.millis();
    private static final Instant FETCHED_AT = Instant.parse("2024-01-03T12:00:00Z");
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);

    @TempDir
    Path root;

    private PartitionedStore store;

    @BeforeEach
    void setUp() {
        store = new PartitionedStore(root, "okx", Clock.fixed(FETCHED_AT, ZoneOffset.UTC));
    }

    /**
     * 120 bars from 2024-01-01T18:00Z: 24 on Jan 1, 96 on Jan 2.
     */
    private static List<Bar> twoDays() {
        return barSeries(T0 + 18 * 3_600_000L, STEP, 120);
    }

    private long lineCount(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file)) {
            return lines.count();
        }
    }

    @Test
    @DisplayName("Bars spanning two dates produce two partitions and a manifest with the full count")
    void twoDateRoundTrip() throws Exception {
        List<Bar> bars = twoDays();

        Manifest manifest = store.write(bars, SYMBOL, FIFTEEN);

        assertEquals(List.of(JAN_1, JAN_2), store.listPartitions(SYMBOL, FIFTEEN));
        List<Bar> day1 = store.readPartition(SYMBOL, FIFTEEN, JAN_1);
        List<Bar> day2 = store.readPartition(SYMBOL, FIFTEEN, JAN_2);
        assertEquals(24, day1.size());
        assertEquals(96, day2.size());
        assertEquals(bars.size(), day1.size() + day2.size());
        assertEquals(120, manifest.rowCount());

        List<Bar> readBack = new ArrayList<>(day1);
        readBack.addAll(day2);
        assertEquals(bars, readBack);
    }

    @Test
    @DisplayName("Files land under exchange/BASE-QUOTE/interval with a CSV header")
    void layout() throws Exception {
        store.write(twoDays(), SYMBOL, FIFTEEN);

        Path dir = root.resolve("okx").resolve("BTC-USDT").resolve("15min");
        assertEquals(dir, store.seriesDir(SYMBOL, FIFTEEN));
        assertTrue(Files.exists(dir.resolve("2024-01-01.csv")));
        assertTrue(Files.exists(dir.resolve("2024-01-02.csv")));
        assertTrue(Files.exists(dir.resolve(Manifest.FILE_NAME)));
        assertEquals(Bar.CSV_HEADER, Files.readAllLines(dir.resolve("2024-01-01.csv")).get(0));
        assertEquals(25, lineCount(dir.resolve("2024-01-01.csv")));

        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")),
                "No temp files should remain");
        }
    }

    @Test
    @DisplayName("Manifest records series, time range, fetch time, version and partition checksums")
    void manifestContents() throws Exception {
        Manifest manifest = store.write(twoDays(), SYMBOL, FIFTEEN);

        assertEquals("okx", manifest.exchangeId());
        assertEquals(SYMBOL, manifest.symbol());
        assertEquals("15min", manifest.interval());
        assertEquals("2024-01-01T18:00:00Z", manifest.startTimestamp());
        assertEquals("2024-01-02T23:45:00Z", manifest.endTimestamp());
        assertEquals("2024-01-03T12:00:00Z", manifest.fetchTimestamp());
        assertEquals(Manifest.FORMAT_VERSION, manifest.version());

        assertEquals(2, manifest.partitions().size());
        PartitionEntry first = manifest.partitions().get(0);
        assertEquals("2024-01-01", first.date());
        assertEquals("2024-01-01.csv", first.file());
        assertEquals(24, first.rowCount());
        assertEquals(PartitionedStore.sha256(store.seriesDir(SYMBOL, FIFTEEN).resolve(first.file())), first.sha256());
        assertEquals(64, first.sha256().length());
    }

    @Test
    @DisplayName("Manifest with validation report reads back equal")
    void manifestReadBack() throws Exception {
        ValidationReport report = new ValidationReport(120, 118, 3, 4,
            Map.of("open", 0, "high", 0, "low", 0, "close", 2, "volume", 0), 1, 2);

        Manifest written = store.write(twoDays(), SYMBOL, FIFTEEN, report);

        Manifest read = store.readManifest(SYMBOL, FIFTEEN).orElseThrow();
        assertEquals(written, read);
        assertEquals(3, read.validation().outliersDetected());
        assertEquals(2, read.validation().missingByColumn().get("close"));
    }

    @Test
    @DisplayName("Manifest JSON uses snake_case keys")
    void manifestJsonKeys() throws Exception {
        store.write(twoDays(), SYMBOL, FIFTEEN, ValidationReport.empty());

        String json = Files.readString(store.seriesDir(SYMBOL, FIFTEEN).resolve(Manifest.FILE_NAME));
        for (String key : List.of("\"exchange_id\"", "\"start_timestamp\"", "\"end_timestamp\"",
                "\"fetch_timestamp\"", "\"row_count\"", "\"version\"", "\"valid_rows\"", "\"gaps_detected\"")) {
            assertTrue(json.contains(key), "Missing key " + key);
        }
    }

    @Test
    @DisplayName("Provenance and outlier flags survive storage")
    void flagsPersist() throws Exception {
        List<Bar> bars = List.of(
            new Bar(SYMBOL, T0, 1, 2, 0.5, 1.5, 10),
            new Bar(SYMBOL, T0 + STEP, 1.5, 1.5, 1.5, 1.5, 0, Provenance.SYNTHESIZED, false),
            new Bar(SYMBOL, T0 + 2 * STEP, 3, 4, 2, 3.5, 99, Provenance.IMPUTED, true));

        store.write(bars, SYMBOL, FIFTEEN);

        assertEquals(bars, store.readPartition(SYMBOL, FIFTEEN, JAN_1));
    }

    @Test
    @DisplayName("Empty input raises EmptyDataException and writes nothing")
    void emptyInput() throws Exception {
        assertThrows(EmptyDataException.class, () -> store.write(List.of(), SYMBOL, FIFTEEN));
        assertTrue(store.readManifest(SYMBOL, FIFTEEN).isEmpty());
        assertTrue(store.listPartitions(SYMBOL, FIFTEEN).isEmpty());
    }

    @Nested
    @DisplayName("Rewrites")
    class Rewrites {

        @Test
        @DisplayName("Rewriting a date replaces that partition and leaves other dates alone")
        void replacesPerDate() throws Exception {
            store.write(twoDays(), SYMBOL, FIFTEEN);
            List<Bar> day1Before = store.readPartition(SYMBOL, FIFTEEN, JAN_1);

            List<Bar> newDay2 = barSeries(T0 + 24 * 3_600_000L, STEP, 10);
            Manifest manifest = store.write(newDay2, SYMBOL, FIFTEEN);

            assertEquals(10, store.readPartition(SYMBOL, FIFTEEN, JAN_2).size());
            assertEquals(day1Before, store.readPartition(SYMBOL, FIFTEEN, JAN_1));
            assertEquals(10, manifest.rowCount());
            assertEquals(10, store.readManifest(SYMBOL, FIFTEEN).orElseThrow().rowCount());
        }

        @Test
        @DisplayName("A failed partition write leaves the previous manifest in place")
        void failureKeepsManifest() throws Exception {
            Manifest previous = store.write(barSeries(T0, STEP, 8), SYMBOL, FIFTEEN);

            // A non-empty directory where the Jan 2 partition should go makes the move fail
            Path blocker = store.seriesDir(SYMBOL, FIFTEEN).resolve("2024-01-02.csv");
            Files.createDirectories(blocker);
            Files.writeString(blocker.resolve("keep"), "x");

            assertThrows(IOException.class, () -> store.write(twoDays(), SYMBOL, FIFTEEN));

            assertEquals(previous, store.readManifest(SYMBOL, FIFTEEN).orElseThrow());
            try (Stream<Path> files = Files.list(store.seriesDir(SYMBOL, FIFTEEN))) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        }
    }

    @Test
    @DisplayName("Micro-priced bars read back exactly")
    void smallPricesRoundTrip() throws Exception {
        String pepe = "PEPE/USDT";
        List<Bar> bars = List.of(
            new Bar(pepe, T0, 9.876e-6, 9.9e-6, 9.801e-6, 9.887e-6, 3.5e11, Provenance.OBSERVED, false),
            new Bar(pepe, T0 + STEP, 9.887e-6, 9.91e-6, 9.85e-6, 9.8999e-6, 2.75e11, Provenance.OBSERVED, false),
            new Bar(pepe, T0 + 2 * STEP, 1.2e-8, 1.3e-8, 1.1e-8, 1.25e-8, 1e15, Provenance.SYNTHESIZED, true));

        store.write(bars, pepe, FIFTEEN);

        assertEquals(bars, store.readPartition(pepe, FIFTEEN, JAN_1));
    }

    @Test
    @DisplayName("Reading an absent partition gives an empty list")
    void absentPartition() throws Exception {
        assertTrue(store.readPartition(SYMBOL, FIFTEEN, JAN_1).isEmpty());
        assertTrue(store.readManifest(SYMBOL, FIFTEEN).isEmpty());
    }

    @Test
    @DisplayName("Malformed partition lines are reported, not skipped")
    void malformedPartition() throws Exception {
        Path dir = store.seriesDir(SYMBOL, FIFTEEN);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("2024-01-01.csv"), Bar.CSV_HEADER + "\n1704067200000,oops\n");

        assertThrows(IOException.class, () -> store.readPartition(SYMBOL, FIFTEEN, JAN_1));
    }
}
