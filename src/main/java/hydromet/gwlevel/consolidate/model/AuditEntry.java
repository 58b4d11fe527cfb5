package hydromet.gwlevel.consolidate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One line of the audit trail: a file reached a stage, with an outcome and a reason.
 */
@Getter
@ToString
@AllArgsConstructor
public final class AuditEntry {

    @JsonProperty("file_id")
    private final String fileId;

    @JsonProperty("region")
    private final String regionCode;

    @JsonProperty("stage")
    private final FileStage stage;

    @JsonProperty("outcome")
    private final String outcome;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("timestamp")
    private final LocalDateTime timestamp;
}
