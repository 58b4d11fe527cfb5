package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.exception.ConsolidationConflictException;
import hydromet.gwlevel.consolidate.model.ConflictResolutionMode;
import hydromet.gwlevel.consolidate.model.ConsolidationConflict;
import hydromet.gwlevel.consolidate.model.RegionTable;
import hydromet.gwlevel.consolidate.model.StationId;
import hydromet.gwlevel.consolidate.model.WideFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stacks the wide frames of one region into a single region table.
 *
 * The row index is the sorted union of all dates, the column index the union
 * of all stations. When two files supply different values for the same cell,
 * the configured {@link ConflictResolutionMode} decides:
 * - LATEST_COVERAGE_WINS: the file with the later coverage end wins, first-seen on a tie
 * - FIRST_SEEN_WINS: the first value folded in wins
 * - FAIL_REGION: the region is rejected
 *
 * Null semantics: a missing reading never replaces a stored value and is not a
 * conflict; a reading fills a cell stored as missing; equal values are not conflicts.
 */
@Service
public class RegionConsolidationService {

    private static final Logger logger = LoggerFactory.getLogger(RegionConsolidationService.class);

    private final ConsolidationConfig config;

    public RegionConsolidationService(ConsolidationConfig config) {
        this.config = config;
    }

    /**
     * Consolidate all frames of one region, folded in list order.
     *
     * @param regionCode the region
     * @param frames     reshaped frames of the region's accepted files
     * @return the region table
     * @throws ConsolidationConflictException in FAIL_REGION mode, on the first conflict
     */
    public RegionTable consolidate(String regionCode, List<WideFrame> frames) {
        RegionAccumulator accumulator = newAccumulator(regionCode);
        for (WideFrame frame : frames) {
            accumulator.add(frame);
        }
        return accumulator.build();
    }

    /**
     * Incremental form of {@link #consolidate}: frames are folded in one at a
     * time so they can be released as soon as they are absorbed.
     */
    public RegionAccumulator newAccumulator(String regionCode) {
        return new RegionAccumulator(regionCode, config.getConflictResolution());
    }

    /**
     * Arena for one region. Confined to a single thread; not reusable after {@link #build()}.
     */
    public static final class RegionAccumulator {

        private final String regionCode;
        private final ConflictResolutionMode mode;

        private final TreeSet<LocalDate> dates = new TreeSet<>();
        private final TreeMap<StationId, TreeMap<LocalDate, Cell>> columns = new TreeMap<>();
        private final List<String> contributingFiles = new ArrayList<>();
        private final List<ConsolidationConflict> conflicts = new ArrayList<>();
        private boolean built;

        RegionAccumulator(String regionCode, ConflictResolutionMode mode) {
            this.regionCode = Objects.requireNonNull(regionCode, "regionCode");
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        public void add(WideFrame frame) {
            if (built) {
                throw new IllegalStateException("Region " + regionCode + " is already built");
            }
            if (!regionCode.equals(frame.getRegionCode())) {
                throw new IllegalArgumentException(String.format("Frame %s belongs to region %s, not %s",
                        frame.getSourceFileId(), frame.getRegionCode(), regionCode));
            }

            Source source = new Source(frame.getSourceFileId(), frame.getCoverageEnd());
            for (StationId station : frame.getStations()) {
                TreeMap<LocalDate, Cell> target = columns.computeIfAbsent(station, s -> new TreeMap<>());
                for (Map.Entry<LocalDate, Double> entry : frame.column(station).entrySet()) {
                    Cell existing = target.get(entry.getKey());
                    if (existing == null) {
                        target.put(entry.getKey(), new Cell(entry.getValue(), source));
                    } else {
                        Cell resolved = resolve(station, entry.getKey(), existing, new Cell(entry.getValue(), source));
                        if (resolved != existing) {
                            target.put(entry.getKey(), resolved);
                        }
                    }
                }
            }
            dates.addAll(frame.getDates());
            contributingFiles.add(frame.getSourceFileId());
        }

        private Cell resolve(StationId station, LocalDate date, Cell existing, Cell incoming) {
            if (incoming.value == null) {
                return existing;
            }
            if (existing.value == null) {
                return incoming;
            }
            if (existing.value.equals(incoming.value)) {
                return existing;
            }

            Cell kept;
            String resolution;
            switch (mode) {
                case LATEST_COVERAGE_WINS:
                    if (incoming.source.isLaterThan(existing.source)) {
                        kept = incoming;
                        resolution = "later coverage wins";
                    } else if (existing.source.isLaterThan(incoming.source)) {
                        kept = existing;
                        resolution = "later coverage wins";
                    } else {
                        kept = existing;
                        resolution = "coverage tie, first seen kept";
                    }
                    break;
                case FIRST_SEEN_WINS:
                    kept = existing;
                    resolution = "first seen kept";
                    break;
                default:
                    kept = existing;
                    resolution = "region rejected";
                    break;
            }

            Cell discarded = kept == existing ? incoming : existing;
            ConsolidationConflict conflict = new ConsolidationConflict(regionCode, station, date,
                    kept.value, kept.source.fileId, discarded.value, discarded.source.fileId, resolution);

            if (mode == ConflictResolutionMode.FAIL_REGION) {
                throw new ConsolidationConflictException(conflict);
            }

            conflicts.add(conflict);
            logger.warn("Conflict in region {} for {} on {}: kept {} from {}, discarded {} from {} ({})",
                    regionCode, station, date, kept.value, kept.source.fileId,
                    discarded.value, discarded.source.fileId, resolution);
            return kept;
        }

        public boolean isEmpty() {
            return contributingFiles.isEmpty();
        }

        public int getConflictCount() {
            return conflicts.size();
        }

        public RegionTable build() {
            built = true;
            TreeMap<StationId, NavigableMap<LocalDate, Double>> values = new TreeMap<>();
            // Drain column by column so the provenance cells can be collected as we go
            while (!columns.isEmpty()) {
                Map.Entry<StationId, TreeMap<LocalDate, Cell>> column = columns.pollFirstEntry();
                TreeMap<LocalDate, Double> cells = new TreeMap<>();
                column.getValue().forEach((date, cell) -> cells.put(date, cell.value));
                values.put(column.getKey(), Collections.unmodifiableNavigableMap(cells));
            }

            RegionTable table = new RegionTable(regionCode, dates, values, contributingFiles, conflicts);
            logger.info("Consolidated region {}: {} files, {} dates, {} stations, {} conflicts",
                    regionCode, contributingFiles.size(), table.getRowCount(), table.getColumnCount(),
                    conflicts.size());
            return table;
        }
    }

    private static final class Cell {
        private final Double value;
        private final Source source;

        private Cell(Double value, Source source) {
            this.value = value;
            this.source = source;
        }
    }

    private static final class Source {
        private final String fileId;
        private final LocalDate coverageEnd;

        private Source(String fileId, LocalDate coverageEnd) {
            this.fileId = fileId;
            this.coverageEnd = coverageEnd;
        }

        boolean isLaterThan(Source other) {
            if (coverageEnd == null) {
                return false;
            }
            return other.coverageEnd == null || coverageEnd.isAfter(other.coverageEnd);
        }
    }
}
