package hydromet.gwlevel.consolidate.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;

/**
 * Vertical union of every accepted file of one region.
 * Holds exactly one value per (date, station) pair.
 */
@Getter
public final class RegionTable implements TimeSeriesTable {

    private final String regionCode;
    private final NavigableSet<LocalDate> dates;
    private final NavigableMap<StationId, NavigableMap<LocalDate, Double>> columns;
    private final List<String> contributingFiles;
    private final List<ConsolidationConflict> conflicts;

    /**
     * Takes ownership of the given collections; callers must not touch them afterwards.
     */
    public RegionTable(String regionCode,
                       NavigableSet<LocalDate> dates,
                       NavigableMap<StationId, NavigableMap<LocalDate, Double>> columns,
                       List<String> contributingFiles,
                       List<ConsolidationConflict> conflicts) {
        this.regionCode = Objects.requireNonNull(regionCode, "regionCode");
        this.dates = Collections.unmodifiableNavigableSet(dates);
        this.columns = Collections.unmodifiableNavigableMap(columns);
        this.contributingFiles = Collections.unmodifiableList(contributingFiles);
        this.conflicts = Collections.unmodifiableList(conflicts);
    }

    @Override
    public Set<StationId> getStations() {
        return columns.keySet();
    }

    @Override
    public NavigableMap<LocalDate, Double> column(StationId station) {
        NavigableMap<LocalDate, Double> cells = columns.get(station);
        return cells != null ? cells : TimeSeriesTable.emptyColumn();
    }

    public LocalDate getFirstDate() {
        return dates.isEmpty() ? null : dates.first();
    }

    public LocalDate getLastDate() {
        return dates.isEmpty() ? null : dates.last();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegionTable)) {
            return false;
        }
        RegionTable other = (RegionTable) o;
        return regionCode.equals(other.regionCode)
                && dates.equals(other.dates)
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionCode, dates, columns);
    }

    @Override
    public String toString() {
        return "RegionTable{region=" + regionCode + ", rows=" + dates.size()
                + ", stations=" + columns.size() + ", conflicts=" + conflicts.size() + "}";
    }
}
