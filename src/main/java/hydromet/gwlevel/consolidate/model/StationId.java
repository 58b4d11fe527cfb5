package hydromet.gwlevel.consolidate.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;
import java.util.Objects;

/**
 * Hierarchical identifier of a monitoring station: Region + District + StationCode.
 * Must be unique across the whole national dataset.
 */
@Getter
@EqualsAndHashCode
public final class StationId implements Comparable<StationId> {

    public static final String DEFAULT_SEPARATOR = "_";

    private static final Comparator<StationId> ORDER = Comparator
            .comparing(StationId::getRegion)
            .thenComparing(StationId::getDistrict)
            .thenComparing(StationId::getStationCode);

    private final String region;
    private final String district;
    private final String stationCode;

    public StationId(String region, String district, String stationCode) {
        this.region = Objects.requireNonNull(region, "region");
        this.district = Objects.requireNonNull(district, "district");
        this.stationCode = Objects.requireNonNull(stationCode, "stationCode");
    }

    /**
     * Render the identifier as a single column label, e.g. "R1_D1_S001".
     */
    public String toLabel(String separator) {
        return region + separator + district + separator + stationCode;
    }

    @Override
    public int compareTo(StationId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toLabel(DEFAULT_SEPARATOR);
    }
}
