package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.model.NationalMatrix;
import hydromet.gwlevel.consolidate.model.SinkAck;
import hydromet.gwlevel.consolidate.model.StationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes the national matrix as a wide CSV file.
 *
 * Layout: a "Date" column followed by one column per station label, one row per
 * date of the axis. Missing readings are written as empty cells.
 *
 * The file is written to {@code <destination>.partial} first and moved into
 * place only once fully flushed, so the destination never holds a truncated matrix.
 */
@Service
public class CsvMatrixSink implements MatrixSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvMatrixSink.class);

    static final String PARTIAL_SUFFIX = ".partial";
    private static final String DATE_HEADER = "Date";

    private final ConsolidationConfig config;
    private final FileChecksumService fileChecksumService;

    public CsvMatrixSink(ConsolidationConfig config, FileChecksumService fileChecksumService) {
        this.config = config;
        this.fileChecksumService = fileChecksumService;
    }

    @Override
    public SinkAck write(NationalMatrix matrix, Path destination) throws IOException {
        if (!matrix.isComplete()) {
            throw new IllegalArgumentException("Refusing to write a " + matrix.getCompleteness()
                    + " matrix to " + destination);
        }

        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path staging = destination.resolveSibling(destination.getFileName() + PARTIAL_SUFFIX);

        List<StationId> stations = new ArrayList<>(matrix.getStations());
        logger.info("Writing national matrix ({} dates x {} stations) to {}",
                matrix.getRowCount(), stations.size(), destination);

        try (BufferedWriter writer = Files.newBufferedWriter(staging, StandardCharsets.UTF_8)) {
            writeHeader(writer, stations);
            writeRows(writer, matrix, stations);
        } catch (IOException e) {
            Files.deleteIfExists(staging);
            throw e;
        }

        moveIntoPlace(staging, destination);

        SinkAck ack = new SinkAck(destination.toString(), matrix.getRowCount(), stations.size(),
                Files.size(destination), fileChecksumService.calculateChecksum(destination));
        logger.info("National matrix written: {} ({} bytes, sha256 {})",
                ack.getLocation(), ack.getBytesWritten(), ack.getChecksum());
        return ack;
    }

    private void writeHeader(BufferedWriter writer, List<StationId> stations) throws IOException {
        String separator = config.getReshape().getLabelSeparator();
        writer.write(DATE_HEADER);
        for (StationId station : stations) {
            writer.write(',');
            writer.write(escape(station.toLabel(separator)));
        }
        writer.newLine();
    }

    /**
     * Walks every column with its own cursor, so each row costs one step per
     * station instead of a map lookup.
     */
    private void writeRows(BufferedWriter writer, NationalMatrix matrix, List<StationId> stations)
            throws IOException {
        List<Iterator<Map.Entry<LocalDate, Double>>> cursors = new ArrayList<>(stations.size());
        List<Map.Entry<LocalDate, Double>> heads = new ArrayList<>(stations.size());
        for (StationId station : stations) {
            Iterator<Map.Entry<LocalDate, Double>> cursor = matrix.column(station).entrySet().iterator();
            cursors.add(cursor);
            heads.add(cursor.hasNext() ? cursor.next() : null);
        }

        for (LocalDate date : matrix.getDates()) {
            writer.write(date.toString());
            for (int i = 0; i < cursors.size(); i++) {
                writer.write(',');
                Map.Entry<LocalDate, Double> head = heads.get(i);
                if (head != null && head.getKey().equals(date)) {
                    if (head.getValue() != null) {
                        writer.write(formatValue(head.getValue()));
                    }
                    Iterator<Map.Entry<LocalDate, Double>> cursor = cursors.get(i);
                    heads.set(i, cursor.hasNext() ? cursor.next() : null);
                }
            }
            writer.newLine();
        }
    }

    private void moveIntoPlace(Path staging, Path destination) throws IOException {
        try {
            Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to a plain replace", destination);
            Files.move(staging, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String formatValue(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
