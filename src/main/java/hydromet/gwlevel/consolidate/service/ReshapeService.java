package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.exception.ReshapeException;
import hydromet.gwlevel.consolidate.model.ColumnLayout;
import hydromet.gwlevel.consolidate.model.ParsedTable;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.StationId;
import hydromet.gwlevel.consolidate.model.StationRecord;
import hydromet.gwlevel.consolidate.model.WideFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Pivots an accepted long-format file (one row per station, date and reading)
 * into a wide frame: one row per date, one column per station.
 *
 * Rules:
 * - Station id = region + district + station code; region falls back to the
 *   file's region code, a blank district to the sentinel district
 * - Duplicate (date, station) rows: the first occurrence is kept, the rest
 *   counted and logged; the file is never dropped for it
 * - Blank or placeholder readings become null cells
 * - Rows with an unreadable date or a non-numeric reading are skipped and counted
 *
 * Stateless; the same file always yields an equal frame.
 */
@Service
public class ReshapeService {

    private static final Logger logger = LoggerFactory.getLogger(ReshapeService.class);

    private final ConsolidationConfig config;
    private final CsvParsingService csvParsingService;
    private final PlaceholderMatcher placeholderMatcher;
    private final ObservationDateParser dateParser;

    public ReshapeService(ConsolidationConfig config,
                          CsvParsingService csvParsingService,
                          PlaceholderMatcher placeholderMatcher,
                          ObservationDateParser dateParser) {
        this.config = config;
        this.csvParsingService = csvParsingService;
        this.placeholderMatcher = placeholderMatcher;
        this.dateParser = dateParser;
    }

    /**
     * Reshape one accepted file.
     *
     * @param file a file the validator accepted
     * @return the wide frame of the file
     * @throws ReshapeException if the file has no usable row or its layout no longer resolves
     */
    public WideFrame reshape(RawFile file) {
        ParsedTable table = csvParsingService.parse(file);
        ColumnLayout layout = config.schemaFor(file.getRegionCode()).resolve(table.getHeaders());
        if (!layout.isComplete()) {
            throw new ReshapeException(file.getFileId(),
                    "Missing required columns: " + layout.getMissingColumns());
        }

        WideFrame.Builder builder = WideFrame.builder(file.getFileId(), file.getRegionCode());
        long lineNumber = 1; // header

        for (List<String> row : table.getRows()) {
            lineNumber++;
            Optional<StationRecord> record = toRecord(file, layout, row, lineNumber);
            if (record.isEmpty()) {
                builder.skipRow();
                continue;
            }
            if (!builder.put(record.get())) {
                logger.warn("Duplicate reading in {} line {}: {} on {} (keeping first occurrence)",
                        file.getFileId(), lineNumber, record.get().getStationId(), record.get().getDate());
            }
        }

        if (builder.isEmpty()) {
            throw new ReshapeException(file.getFileId(),
                    String.format("No usable rows (%d skipped)", builder.getSkippedRowCount()));
        }

        WideFrame frame = builder.build(file.getReportedPeriodEnd());
        if (frame.getDuplicateRowCount() > 0 || frame.getSkippedRowCount() > 0) {
            logger.warn("Reshaped {} with {} duplicate and {} skipped rows",
                    file.getFileId(), frame.getDuplicateRowCount(), frame.getSkippedRowCount());
        }
        logger.debug("Reshaped {}: {} dates x {} stations", file.getFileId(),
                frame.getRowCount(), frame.getColumnCount());
        return frame;
    }

    private Optional<StationRecord> toRecord(RawFile file, ColumnLayout layout, List<String> row, long lineNumber) {
        String stationCode = ParsedTable.cell(row, layout.getStationIndex()).trim();
        if (stationCode.isEmpty()) {
            logger.debug("Skipping {} line {}: no station code", file.getFileId(), lineNumber);
            return Optional.empty();
        }

        Optional<LocalDate> date = dateParser.parse(ParsedTable.cell(row, layout.getDateIndex()));
        if (date.isEmpty()) {
            logger.debug("Skipping {} line {}: unreadable date '{}'", file.getFileId(), lineNumber,
                    ParsedTable.cell(row, layout.getDateIndex()));
            return Optional.empty();
        }

        String rawLevel = ParsedTable.cell(row, layout.getLevelIndex());
        Double value = null;
        if (!placeholderMatcher.isMissing(rawLevel)) {
            try {
                value = Double.valueOf(rawLevel.trim());
            } catch (NumberFormatException e) {
                logger.debug("Skipping {} line {}: non-numeric level '{}'", file.getFileId(), lineNumber, rawLevel);
                return Optional.empty();
            }
            if (value.isNaN() || value.isInfinite()) {
                return Optional.empty();
            }
        }

        String region = ParsedTable.cell(row, layout.getRegionIndex()).trim();
        if (region.isEmpty()) {
            region = file.getRegionCode();
        }
        String district = ParsedTable.cell(row, layout.getDistrictIndex()).trim();
        if (district.isEmpty()) {
            district = config.getReshape().getSentinelDistrict();
        }

        return Optional.of(new StationRecord(new StationId(region, district, stationCode), date.get(), value));
    }
}
