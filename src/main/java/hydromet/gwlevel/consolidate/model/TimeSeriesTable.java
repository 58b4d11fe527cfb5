package hydromet.gwlevel.consolidate.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;

/**
 * Read view shared by every wide table in the pipeline: a strictly increasing
 * date axis, a set of station columns and sparse cells.
 *
 * Cells that were never supplied read back as {@code null}; so do cells that
 * were supplied with a missing reading. {@link #hasCell} tells them apart.
 */
public interface TimeSeriesTable {

    NavigableSet<LocalDate> getDates();

    Set<StationId> getStations();

    /**
     * Observed cells of one station, keyed by date. Empty if the station is unknown.
     */
    NavigableMap<LocalDate, Double> column(StationId station);

    default boolean hasCell(LocalDate date, StationId station) {
        return column(station).containsKey(date);
    }

    default Double getValue(LocalDate date, StationId station) {
        return column(station).get(date);
    }

    default int getRowCount() {
        return getDates().size();
    }

    default int getColumnCount() {
        return getStations().size();
    }

    default long getCellCount() {
        long count = 0;
        for (StationId station : getStations()) {
            count += column(station).size();
        }
        return count;
    }

    static NavigableMap<LocalDate, Double> emptyColumn() {
        return Collections.emptyNavigableMap();
    }
}
