package hydromet.gwlevel.consolidate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for the result of one consolidation run
 * Shows per-file dispositions, per-region results and the national matrix shape
 */
@Data
@NoArgsConstructor
public class ConsolidationReportDto {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_CANCELLED = "CANCELLED";

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("status")
    private String status; // COMPLETED, FAILED, CANCELLED

    @JsonProperty("completeness")
    private String completeness; // PARTIAL, COMPLETE

    @JsonProperty("input_root")
    private String inputRoot;

    @JsonProperty("output_location")
    private String outputLocation;

    @JsonProperty("files_discovered")
    private Integer filesDiscovered;

    @JsonProperty("audit_summary")
    private AuditSummaryDto auditSummary;

    @JsonProperty("regions_merged")
    private Integer regionsMerged;

    @JsonProperty("regions_skipped")
    private List<String> regionsSkipped;

    @JsonProperty("station_count")
    private Integer stationCount;

    @JsonProperty("date_count")
    private Integer dateCount;

    @JsonProperty("first_date")
    private LocalDate firstDate;

    @JsonProperty("last_date")
    private LocalDate lastDate;

    @JsonProperty("conflict_count")
    private Integer conflictCount;

    @JsonProperty("region_summaries")
    private List<RegionSummary> regionSummaries;

    @JsonProperty("processing_start_time")
    private LocalDateTime processingStartTime;

    @JsonProperty("processing_end_time")
    private LocalDateTime processingEndTime;

    @JsonProperty("processing_duration_ms")
    private Long processingDurationMs;

    @JsonProperty("error_message")
    private String errorMessage;

    // Inner class for the result of one region
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegionSummary {
        @JsonProperty("region")
        private String region;

        @JsonProperty("status")
        private String status; // CONSOLIDATED, SKIPPED, FAILED

        @JsonProperty("files_total")
        private Integer filesTotal;

        @JsonProperty("files_consolidated")
        private Integer filesConsolidated;

        @JsonProperty("station_count")
        private Integer stationCount;

        @JsonProperty("date_count")
        private Integer dateCount;

        @JsonProperty("conflict_count")
        private Integer conflictCount;

        @JsonProperty("error_message")
        private String errorMessage;
    }
}
