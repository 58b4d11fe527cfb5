package hydromet.gwlevel.consolidate.config;

import hydromet.gwlevel.consolidate.model.ConflictResolutionMode;
import hydromet.gwlevel.consolidate.model.RegionSchema;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the consolidation pipeline
 *
 * Maps properties from application.properties with prefix "consolidation":
 * - consolidation.input-root
 * - consolidation.output-file
 * - consolidation.region-folder-marker
 * - consolidation.conflict-resolution
 * - consolidation.default-schema.*
 * - consolidation.regions.<region-code>.*
 * - consolidation.validation.*
 * - consolidation.reshape.*
 * - consolidation.executors.*
 * - consolidation.audit.*
 */
@Configuration
@ConfigurationProperties(prefix = "consolidation")
@Data
public class ConsolidationConfig {

    // ========================================
    // INPUT / OUTPUT
    // ========================================

    /** Parent folder holding one sub-folder per region */
    private String inputRoot = "data/source";

    /** Destination of the national matrix CSV */
    private String outputFile = "national_groundwater_levels.csv";

    /** Only sub-folders whose name contains this text are treated as region folders */
    private String regionFolderMarker = "groundWater";

    /** Separator between the region code and the rest of a region folder name */
    private String regionNameDelimiter = "_";

    /** File suffixes picked up inside a region folder */
    private List<String> supportedExtensions = new ArrayList<>(List.of(".csv", ".csv.gz"));

    // ========================================
    // SCHEMAS
    // ========================================

    /** Layout used by every region without its own entry */
    private RegionSchema defaultSchema = new RegionSchema();

    /** Region-specific layouts keyed by region code */
    private Map<String, RegionSchema> regions = new HashMap<>();

    // ========================================
    // STAGE SETTINGS
    // ========================================

    private ConflictResolutionMode conflictResolution = ConflictResolutionMode.LATEST_COVERAGE_WINS;

    private Validation validation = new Validation();

    private Reshape reshape = new Reshape();

    private Executors executors = new Executors();

    private Audit audit = new Audit();

    @Data
    public static class Validation {
        /** Files with fewer data rows are treated as noise */
        private int minimumRows = 2;

        /** Regular expressions (full match, case-insensitive) for "no data" markers */
        private List<String> placeholderPatterns = new ArrayList<>(List.of(
                "No Data Available", "NA", "N/A", "-+", "null", "NaN", "nil"));
    }

    @Data
    public static class Reshape {
        /** District label for stations without district metadata */
        private String sentinelDistrict = "UNKNOWN";

        /** Separator used when rendering a station identifier as a column label */
        private String labelSeparator = "_";

        /** Accepted date formats, tried in order */
        private List<String> datePatterns = new ArrayList<>(List.of(
                "yyyy-MM-dd", "dd-MM-yyyy", "dd/MM/yyyy", "yyyy/MM/dd", "dd.MM.yyyy"));

        /**
         * Regex with named groups "start" and "end" that extracts a reporting
         * period from a filename. Groups may hold a year or an ISO date. The period
         * must close the name, before the extensions, and may not follow a digit,
         * so numeric station codes are never read as years.
         */
        private String reportingPeriodPattern = "(?<![0-9])(?<start>\\d{4}(?:-\\d{2}-\\d{2})?)[_-]"
                + "(?<end>\\d{4}(?:-\\d{2}-\\d{2})?)(?:\\.[A-Za-z]+)*$";
    }

    @Data
    public static class Executors {
        /** Worker threads validating and reshaping files */
        private int fileProcessingThreads = 4;

        /** Regions consolidated concurrently */
        private int regionConsolidationThreads = 4;

        /** File tasks a region keeps submitted ahead of its fold */
        private int regionFilesInFlight = 8;

        private int queueCapacity = 10000;

        private int awaitTerminationSeconds = 60;
    }

    @Data
    public static class Audit {
        /** JSON-lines mirror of the audit trail, written at the end of a run. Empty to disable */
        private String logFile = "";
    }

    /**
     * Schema for the given region, falling back to the default schema.
     */
    public RegionSchema schemaFor(String regionCode) {
        if (regionCode != null) {
            RegionSchema schema = regions.get(regionCode);
            if (schema != null) {
                return schema;
            }
        }
        return defaultSchema;
    }
}
