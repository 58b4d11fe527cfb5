package hydromet.gwlevel.consolidate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error body returned when a run request is refused.
 * A failed run carries its report so the caller still sees what was processed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("report")
    private ConsolidationReportDto report;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    public ErrorResponseDto(String error, String message) {
        this(error, message, null, LocalDateTime.now());
    }

    public ErrorResponseDto(String error, String message, ConsolidationReportDto report) {
        this(error, message, report, LocalDateTime.now());
    }
}
