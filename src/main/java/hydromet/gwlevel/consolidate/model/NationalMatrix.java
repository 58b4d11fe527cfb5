package hydromet.gwlevel.consolidate.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Outer join of every region table on the date axis.
 *
 * Columns are ordered by {@link StationId}, so the matrix does not depend on
 * the order in which regions were folded in. A (date, station) pair outside
 * the station's own region table reads back as an explicit null.
 */
@Getter
public final class NationalMatrix implements TimeSeriesTable {

    public enum Completeness {
        /** Still being merged, or never passed the integrity checks. */
        PARTIAL,
        /** Every region merged and every integrity check passed. */
        COMPLETE
    }

    private final NavigableSet<LocalDate> dates;
    private final NavigableMap<StationId, NavigableMap<LocalDate, Double>> columns;
    private final SortedSet<String> regionCodes;
    private final Completeness completeness;

    /**
     * Takes ownership of the given collections; callers must not touch them afterwards.
     */
    public NationalMatrix(NavigableSet<LocalDate> dates,
                          NavigableMap<StationId, NavigableMap<LocalDate, Double>> columns,
                          SortedSet<String> regionCodes,
                          Completeness completeness) {
        this.dates = Collections.unmodifiableNavigableSet(dates);
        this.columns = Collections.unmodifiableNavigableMap(columns);
        this.regionCodes = Collections.unmodifiableSortedSet(regionCodes);
        this.completeness = Objects.requireNonNull(completeness, "completeness");
    }

    private NationalMatrix(NationalMatrix source, Completeness completeness) {
        this.dates = source.dates;
        this.columns = source.columns;
        this.regionCodes = source.regionCodes;
        this.completeness = completeness;
    }

    /**
     * Same data, tagged as complete. Only the merge service calls this, after its integrity checks.
     */
    public NationalMatrix sealComplete() {
        return new NationalMatrix(this, Completeness.COMPLETE);
    }

    public boolean isComplete() {
        return completeness == Completeness.COMPLETE;
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
        if (!(o instanceof NationalMatrix)) {
            return false;
        }
        NationalMatrix other = (NationalMatrix) o;
        return completeness == other.completeness
                && regionCodes.equals(other.regionCodes)
                && dates.equals(other.dates)
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(completeness, regionCodes, dates, columns);
    }

    @Override
    public String toString() {
        return "NationalMatrix{" + completeness + ", regions=" + regionCodes.size()
                + ", rows=" + dates.size() + ", stations=" + columns.size() + "}";
    }
}
