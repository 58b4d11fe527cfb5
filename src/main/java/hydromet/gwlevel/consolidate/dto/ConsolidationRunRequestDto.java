package hydromet.gwlevel.consolidate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for starting a run. Blank fields fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationRunRequestDto {

    @JsonProperty("input_root")
    private String inputRoot;

    @JsonProperty("output_file")
    private String outputFile;
}
