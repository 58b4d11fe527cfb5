package hydromet.gwlevel.consolidate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for the audit trail summary
 * Accepted/rejected counts and the reasons files were turned away
 */
@Data
@NoArgsConstructor
public class AuditSummaryDto {

    @JsonProperty("files_validated")
    private Integer filesValidated;

    @JsonProperty("files_accepted")
    private Integer filesAccepted;

    @JsonProperty("files_rejected")
    private Integer filesRejected;

    @JsonProperty("reshape_failures")
    private Integer reshapeFailures;

    @JsonProperty("files_merged")
    private Integer filesMerged;

    @JsonProperty("outcome_counts")
    private Map<String, Integer> outcomeCounts; // ACCEPTED, REJECTED_EMPTY, ...

    @JsonProperty("rejection_reasons")
    private Map<String, Integer> rejectionReasons; // reason -> number of files
}
