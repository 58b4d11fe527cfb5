package hydromet.gwlevel.consolidate.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Wide, date-indexed view of one accepted source file.
 * Produced by the reshaper and consumed once by the region consolidator.
 */
@Getter
public final class WideFrame implements TimeSeriesTable {

    private final String sourceFileId;
    private final String regionCode;

    /** Last date the source file reports for; drives the region conflict policy. */
    private final LocalDate coverageEnd;

    private final NavigableSet<LocalDate> dates;
    private final NavigableMap<StationId, NavigableMap<LocalDate, Double>> columns;

    private final int duplicateRowCount;
    private final int skippedRowCount;

    private WideFrame(Builder builder, LocalDate coverageEnd) {
        this.sourceFileId = builder.sourceFileId;
        this.regionCode = builder.regionCode;
        this.coverageEnd = coverageEnd;
        this.dates = Collections.unmodifiableNavigableSet(builder.dates);
        TreeMap<StationId, NavigableMap<LocalDate, Double>> frozen = new TreeMap<>();
        builder.columns.forEach((station, cells) -> frozen.put(station, Collections.unmodifiableNavigableMap(cells)));
        this.columns = Collections.unmodifiableNavigableMap(frozen);
        this.duplicateRowCount = builder.duplicateRowCount;
        this.skippedRowCount = builder.skippedRowCount;
    }

    public static Builder builder(String sourceFileId, String regionCode) {
        return new Builder(sourceFileId, regionCode);
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

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WideFrame)) {
            return false;
        }
        WideFrame other = (WideFrame) o;
        return sourceFileId.equals(other.sourceFileId)
                && regionCode.equals(other.regionCode)
                && Objects.equals(coverageEnd, other.coverageEnd)
                && dates.equals(other.dates)
                && columns.equals(other.columns)
                && duplicateRowCount == other.duplicateRowCount
                && skippedRowCount == other.skippedRowCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceFileId, regionCode, coverageEnd, dates, columns);
    }

    @Override
    public String toString() {
        return "WideFrame{file=" + sourceFileId + ", region=" + regionCode
                + ", rows=" + dates.size() + ", stations=" + columns.size() + "}";
    }

    /**
     * Single-threaded accumulator used while pivoting one file.
     */
    public static final class Builder {

        private final String sourceFileId;
        private final String regionCode;
        private final TreeSet<LocalDate> dates = new TreeSet<>();
        private final TreeMap<StationId, TreeMap<LocalDate, Double>> columns = new TreeMap<>();
        private int duplicateRowCount;
        private int skippedRowCount;

        private Builder(String sourceFileId, String regionCode) {
            this.sourceFileId = Objects.requireNonNull(sourceFileId, "sourceFileId");
            this.regionCode = Objects.requireNonNull(regionCode, "regionCode");
        }

        /**
         * Place one observation. The first reading of a (date, station) pair wins;
         * a reading fills the cell when earlier rows for the pair were missing.
         * Every repeated row counts as a duplicate.
         *
         * @return false if the cell already held a reading
         */
        public boolean put(StationRecord record) {
            TreeMap<LocalDate, Double> cells = columns.computeIfAbsent(record.getStationId(), s -> new TreeMap<>());
            if (cells.containsKey(record.getDate())) {
                duplicateRowCount++;
                if (cells.get(record.getDate()) == null && record.getValue() != null) {
                    cells.put(record.getDate(), record.getValue());
                    return true;
                }
                return false;
            }
            cells.put(record.getDate(), record.getValue());
            dates.add(record.getDate());
            return true;
        }

        public void skipRow() {
            skippedRowCount++;
        }

        public int getDuplicateRowCount() {
            return duplicateRowCount;
        }

        public int getSkippedRowCount() {
            return skippedRowCount;
        }

        public boolean isEmpty() {
            return dates.isEmpty();
        }

        /**
         * @param reportedCoverageEnd coverage end announced by the file's metadata, or null
         *                            to fall back to the latest date in the data
         */
        public WideFrame build(LocalDate reportedCoverageEnd) {
            LocalDate coverageEnd = reportedCoverageEnd != null
                    ? reportedCoverageEnd
                    : (dates.isEmpty() ? null : dates.last());
            return new WideFrame(this, coverageEnd);
        }
    }
}
