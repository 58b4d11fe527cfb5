package hydromet.gwlevel.consolidate.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * One long-format observation: a station, a date and a measured depth.
 * The depth is null when the reading is missing.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class StationRecord {

    private final StationId stationId;
    private final LocalDate date;
    private final Double value;
}
