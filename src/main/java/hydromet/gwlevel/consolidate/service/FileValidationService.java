package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.model.ColumnLayout;
import hydromet.gwlevel.consolidate.model.ParsedTable;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.RegionSchema;
import hydromet.gwlevel.consolidate.model.ValidationVerdict;
import hydromet.gwlevel.consolidate.model.ValidationVerdict.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service deciding whether a raw station file is usable
 *
 * Checks, in order, stopping at the first failure:
 * 1. Content: at least one data row below the header
 * 2. Schema: the region's required columns are present
 * 3. Placeholders: the level column is not made up of "no data" markers only
 * 4. Size: at least the configured minimum number of data rows
 *
 * Most files of a real delivery fail one of these checks. This service never
 * throws on malformed input: every file gets a verdict, and every verdict is
 * written to the audit trail.
 */
@Service
@Slf4j
public class FileValidationService {

    private final ConsolidationConfig config;
    private final CsvParsingService csvParsingService;
    private final PlaceholderMatcher placeholderMatcher;
    private final AuditTrailService auditTrailService;

    public FileValidationService(
            ConsolidationConfig config,
            CsvParsingService csvParsingService,
            PlaceholderMatcher placeholderMatcher,
            AuditTrailService auditTrailService) {
        this.config = config;
        this.csvParsingService = csvParsingService;
        this.placeholderMatcher = placeholderMatcher;
        this.auditTrailService = auditTrailService;
    }

    /**
     * Validate one raw file and record the verdict in the audit trail.
     *
     * @param file the raw file
     * @return the verdict, never null
     */
    public ValidationVerdict validate(RawFile file) {
        ValidationVerdict verdict;
        try {
            verdict = runChecks(file);
        } catch (RuntimeException e) {
            log.warn("Unreadable file {} in region {}: {}", file.getFileId(), file.getRegionCode(), e.toString());
            verdict = ValidationVerdict.rejected(file, Outcome.REJECTED_OTHER,
                    "Unreadable content: " + e.getClass().getSimpleName());
        }

        if (verdict.isAccepted()) {
            log.debug("Accepted {}: {}", file.getFileId(), verdict.getReason());
        } else {
            log.debug("Rejected {} ({}): {}", file.getFileId(), verdict.getOutcome(), verdict.getReason());
        }

        auditTrailService.record(file.getFileId(), verdict);
        return verdict;
    }

    private ValidationVerdict runChecks(RawFile file) {
        // Step 0: binary garbage never parses into a meaningful table
        if (csvParsingService.looksBinary(file.getContent())) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_OTHER, "Binary content");
        }

        // Step 1: non-empty content
        ParsedTable table = csvParsingService.parse(file);
        if (!table.hasHeader()) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_EMPTY, "No header and no data rows");
        }
        if (table.getRowCount() == 0) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_EMPTY, "No data rows below header");
        }

        // Step 2: required columns for this region
        RegionSchema schema = config.schemaFor(file.getRegionCode());
        ColumnLayout layout = schema.resolve(table.getHeaders());
        if (!layout.isComplete()) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_MISSING_COLUMNS,
                    "Missing required columns: " + layout.getMissingColumns());
        }

        // Step 3: placeholder-only level column
        if (isPlaceholderOnly(table, layout)) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_PLACEHOLDER,
                    "Level column holds no readings, only placeholders");
        }

        // Step 4: minimum row threshold
        int minimumRows = config.getValidation().getMinimumRows();
        if (table.getRowCount() < minimumRows) {
            return ValidationVerdict.rejected(file, Outcome.REJECTED_OTHER,
                    String.format("Below minimum row threshold of %d", minimumRows));
        }

        return ValidationVerdict.accepted(file,
                String.format("%d data rows, %d columns", table.getRowCount(), table.getHeaders().size()));
    }

    /**
     * True if no row carries a reading in the level column. A single-row file
     * with a placeholder in any cell is also a placeholder file: that is how
     * exports mark stations without data.
     */
    private boolean isPlaceholderOnly(ParsedTable table, ColumnLayout layout) {
        if (table.getRowCount() == 1) {
            for (String value : table.getRows().get(0)) {
                if (placeholderMatcher.isPlaceholder(value)) {
                    return true;
                }
            }
        }

        for (List<String> row : table.getRows()) {
            String level = ParsedTable.cell(row, layout.getLevelIndex());
            if (!placeholderMatcher.isMissing(level)) {
                return false;
            }
        }
        return true;
    }
}
