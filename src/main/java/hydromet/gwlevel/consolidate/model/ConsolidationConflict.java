package hydromet.gwlevel.consolidate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Two source files of the same region supplied different values for one
 * (date, station) cell. Non-fatal; resolved by the configured policy.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ConsolidationConflict {

    @JsonProperty("region")
    private final String regionCode;

    @JsonProperty("station")
    private final StationId stationId;

    @JsonProperty("date")
    private final LocalDate date;

    @JsonProperty("kept_value")
    private final Double keptValue;

    @JsonProperty("kept_file")
    private final String keptFileId;

    @JsonProperty("discarded_value")
    private final Double discardedValue;

    @JsonProperty("discarded_file")
    private final String discardedFileId;

    @JsonProperty("resolution")
    private final String resolution;
}
