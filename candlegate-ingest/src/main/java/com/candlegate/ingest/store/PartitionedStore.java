package com.candlegate.ingest.store;

import com.candlegate.core.exception.EmptyDataException;
import com.candlegate.core.model.Bar;
import com.candlegate.core.model.Interval;
import com.candlegate.core.model.Manifest;
import com.candlegate.core.model.PartitionEntry;
import com.candlegate.core.model.ValidationReport;
import com.candlegate.ingest.exchange.HttpClientFactory;
import com.candlegate.ingest.exchange.Symbols;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Stores bars as one CSV file per UTC calendar day, plus a manifest per series.
 * Layout: {root}/{exchange}/{BASE-QUOTE}/{interval}/{YYYY-MM-DD}.csv and manifest.json
 *
 * Every file is written to a temp file in the same directory and then moved over its target,
 * so readers see either the old or the new content. The manifest is moved last: if a write
 * fails part way the previous manifest stays in place.
 */
public class PartitionedStore {

    private static final Logger log = LoggerFactory.getLogger(PartitionedStore.class);
    private static final String PARTITION_SUFFIX = ".csv";

    private final Path root;
    private final String exchangeId;
    private final Clock clock;
    private final ObjectMapper mapper;

    public PartitionedStore(Path root, String exchangeId) {
        this(root, exchangeId, Clock.systemUTC());
    }

    public PartitionedStore(Path root, String exchangeId, Clock clock) {
        this.root = root;
        this.exchangeId = exchangeId;
        this.clock = clock;
        this.mapper = HttpClientFactory.getMapper();
    }

    /**
     * Directory holding the partitions and manifest of one series.
     */
    public Path seriesDir(String symbol, Interval interval) {
        return root.resolve(exchangeId)
            .resolve(Symbols.toPathSegment(symbol))
            .resolve(interval.label());
    }

    public Manifest write(List<Bar> bars, String symbol, Interval interval) throws EmptyDataException, IOException {
        return write(bars, symbol, interval, null);
    }

    /**
     * Write bars grouped by UTC date, replacing those dates' files, then replace the manifest.
     *
     * @param report validation summary recorded in the manifest, may be null
     * @return the manifest that was written
     * @throws EmptyDataException if there is nothing to write
     * @throws IOException        on any filesystem failure; the previous manifest is left untouched
     */
    public Manifest write(List<Bar> bars, String symbol, Interval interval, ValidationReport report)
            throws EmptyDataException, IOException {
        if (bars == null || bars.isEmpty()) {
            throw new EmptyDataException("No bars to write for " + symbol + " " + interval);
        }

        Path dir = seriesDir(symbol, interval);
        Files.createDirectories(dir);

        Map<LocalDate, List<Bar>> byDate = new TreeMap<>();
        for (Bar bar : bars) {
            LocalDate date = bar.instant().atZone(ZoneOffset.UTC).toLocalDate();
            byDate.computeIfAbsent(date, d -> new ArrayList<>()).add(bar);
        }

        List<PartitionEntry> partitions = new ArrayList<>();
        for (var entry : byDate.entrySet()) {
            List<Bar> dayBars = entry.getValue();
            dayBars.sort(Comparator.comparingLong(Bar::timestamp));

            String fileName = entry.getKey() + PARTITION_SUFFIX;
            Path tmp = Files.createTempFile(dir, "." + entry.getKey() + "-", ".tmp");
            try {
                CsvUtils.writeCsv(tmp, Bar.CSV_HEADER, dayBars, Bar::toCsv);
                String sha256 = sha256(tmp);
                moveIntoPlace(tmp, dir.resolve(fileName));
                partitions.add(new PartitionEntry(entry.getKey().toString(), fileName, dayBars.size(), sha256));
            } finally {
                Files.deleteIfExists(tmp);
            }
        }

        long first = bars.stream().mapToLong(Bar::timestamp).min().getAsLong();
        long last = bars.stream().mapToLong(Bar::timestamp).max().getAsLong();
        Manifest manifest = new Manifest(
            exchangeId,
            symbol,
            interval.label(),
            Instant.ofEpochMilli(first).toString(),
            Instant.ofEpochMilli(last).toString(),
            clock.instant().toString(),
            Manifest.FORMAT_VERSION,
            bars.size(),
            partitions,
            report);

        writeManifest(dir, manifest);
        log.info("Wrote {} bars for {} {} into {} partitions under {}",
            bars.size(), symbol, interval, partitions.size(), dir);
        return manifest;
    }

    /**
     * Bars stored for one date, empty if the partition does not exist.
     */
    public List<Bar> readPartition(String symbol, Interval interval, LocalDate date) throws IOException {
        Path file = seriesDir(symbol, interval).resolve(date + PARTITION_SUFFIX);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        return CsvUtils.readCsv(file, "timestamp", line -> Bar.fromCsv(symbol, line));
    }

    public Optional<Manifest> readManifest(String symbol, Interval interval) throws IOException {
        Path file = seriesDir(symbol, interval).resolve(Manifest.FILE_NAME);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), Manifest.class));
    }

    /**
     * Dates that have a partition file, ascending.
     */
    public List<LocalDate> listPartitions(String symbol, Interval interval) throws IOException {
        Path dir = seriesDir(symbol, interval);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }

        List<LocalDate> dates = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!name.endsWith(PARTITION_SUFFIX)) continue;
                try {
                    dates.add(LocalDate.parse(name.substring(0, name.length() - PARTITION_SUFFIX.length())));
                } catch (DateTimeParseException e) {
                    log.debug("Ignoring non-partition file {}", file);
                }
            }
        }
        dates.sort(Comparator.naturalOrder());
        return dates;
    }

    private void writeManifest(Path dir, Manifest manifest) throws IOException {
        Path tmp = Files.createTempFile(dir, ".manifest-", ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), manifest);
            moveIntoPlace(tmp, dir.resolve(Manifest.FILE_NAME));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
