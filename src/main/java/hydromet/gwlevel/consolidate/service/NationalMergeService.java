package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.exception.MergeIntegrityException;
import hydromet.gwlevel.consolidate.model.NationalMatrix;
import hydromet.gwlevel.consolidate.model.NationalMatrix.Completeness;
import hydromet.gwlevel.consolidate.model.RegionTable;
import hydromet.gwlevel.consolidate.model.StationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outer-joins region tables on the date axis into the national matrix.
 *
 * Regions are folded in one at a time, so at most the accumulated matrix and
 * the incoming region table are held. Columns and dates are kept in sorted
 * maps, which makes the result independent of the order regions arrive in.
 *
 * Integrity violations are fatal and raise {@link MergeIntegrityException}:
 * - a region merged twice
 * - a station id present in two regions
 * - two stations rendering to the same column label
 * - a date axis that is not strictly increasing
 * - a column count different from the sum of the region column counts
 */
@Service
public class NationalMergeService {

    private static final Logger logger = LoggerFactory.getLogger(NationalMergeService.class);

    private final ConsolidationConfig config;

    public NationalMergeService(ConsolidationConfig config) {
        this.config = config;
    }

    /**
     * Merge all region tables. The result is the same for any order of the list.
     *
     * @param regionTables one table per region
     * @return the sealed, complete national matrix
     * @throws MergeIntegrityException on any structural violation
     */
    public NationalMatrix merge(List<RegionTable> regionTables) {
        NationalAccumulator accumulator = newAccumulator();
        for (RegionTable table : regionTables) {
            accumulator.add(table);
        }
        return accumulator.complete();
    }

    public NationalAccumulator newAccumulator() {
        return new NationalAccumulator(config.getReshape().getLabelSeparator());
    }

    /**
     * Fold state of one national merge. Confined to a single thread.
     */
    public static final class NationalAccumulator {

        private final String labelSeparator;

        private final TreeSet<LocalDate> dates = new TreeSet<>();
        private final TreeMap<StationId, NavigableMap<LocalDate, Double>> columns = new TreeMap<>();
        private final Map<StationId, String> stationOwners = new HashMap<>();
        private final Map<String, StationId> labels = new HashMap<>();
        private final TreeSet<String> regionCodes = new TreeSet<>();
        private long expectedColumnCount;
        private boolean completed;

        NationalAccumulator(String labelSeparator) {
            this.labelSeparator = labelSeparator;
        }

        /**
         * Fold one region table into the matrix.
         *
         * @throws MergeIntegrityException if the region or one of its stations was already merged
         */
        public void add(RegionTable table) {
            if (completed) {
                throw new IllegalStateException("National merge already completed");
            }
            if (!regionCodes.add(table.getRegionCode())) {
                throw new MergeIntegrityException("Region merged twice: " + table.getRegionCode());
            }

            // Check every station before touching the matrix so a failed add leaves it unchanged
            Map<String, StationId> incomingLabels = new HashMap<>();
            for (StationId station : table.getStations()) {
                String owner = stationOwners.get(station);
                if (owner != null) {
                    regionCodes.remove(table.getRegionCode());
                    throw new MergeIntegrityException(String.format(
                            "Station %s appears in regions %s and %s", station, owner, table.getRegionCode()));
                }
                String label = station.toLabel(labelSeparator);
                StationId clash = labels.get(label);
                if (clash == null) {
                    clash = incomingLabels.put(label, station);
                }
                if (clash != null) {
                    regionCodes.remove(table.getRegionCode());
                    throw new MergeIntegrityException(String.format(
                            "Stations (%s, %s, %s) and (%s, %s, %s) both render as column '%s'",
                            clash.getRegion(), clash.getDistrict(), clash.getStationCode(),
                            station.getRegion(), station.getDistrict(), station.getStationCode(), label));
                }
            }

            for (StationId station : table.getStations()) {
                stationOwners.put(station, table.getRegionCode());
                // Region columns are immutable, so the matrix can share them
                columns.put(station, table.column(station));
            }
            labels.putAll(incomingLabels);
            dates.addAll(table.getDates());
            expectedColumnCount += table.getColumnCount();

            logger.info("Merged region {} ({} stations, {} dates); matrix now {} stations x {} dates",
                    table.getRegionCode(), table.getColumnCount(), table.getRowCount(),
                    columns.size(), dates.size());
        }

        /**
         * Current state, tagged PARTIAL. Never mistaken for a finished matrix.
         */
        public NationalMatrix snapshot() {
            TreeMap<StationId, NavigableMap<LocalDate, Double>> columnCopy = new TreeMap<>(columns);
            return new NationalMatrix(new TreeSet<>(dates), columnCopy, new TreeSet<>(regionCodes),
                    Completeness.PARTIAL);
        }

        /**
         * Run the post-merge integrity checks and seal the matrix as COMPLETE.
         *
         * @throws MergeIntegrityException if any check fails
         */
        public NationalMatrix complete() {
            completed = true;
            verifyIntegrity();
            NationalMatrix matrix = new NationalMatrix(dates, columns, regionCodes, Completeness.PARTIAL);
            logger.info("National merge complete: {} regions, {} stations, {} dates ({} to {})",
                    regionCodes.size(), matrix.getColumnCount(), matrix.getRowCount(),
                    matrix.getFirstDate(), matrix.getLastDate());
            return matrix.sealComplete();
        }

        private void verifyIntegrity() {
            if (columns.size() != expectedColumnCount) {
                throw new MergeIntegrityException(String.format(
                        "Column count %d does not match the %d stations of the merged regions",
                        columns.size(), expectedColumnCount));
            }

            LocalDate previous = null;
            for (LocalDate date : dates) {
                if (previous != null && !date.isAfter(previous)) {
                    throw new MergeIntegrityException(String.format(
                            "Date axis not strictly increasing at %s after %s", date, previous));
                }
                previous = date;
            }

            for (Map.Entry<StationId, NavigableMap<LocalDate, Double>> column : columns.entrySet()) {
                NavigableMap<LocalDate, Double> cells = column.getValue();
                if (!cells.isEmpty() && (!dates.contains(cells.firstKey()) || !dates.contains(cells.lastKey()))) {
                    throw new MergeIntegrityException(String.format(
                            "Station %s has readings outside the merged date axis", column.getKey()));
                }
            }
        }

        public int getRegionCount() {
            return regionCodes.size();
        }
    }
}
