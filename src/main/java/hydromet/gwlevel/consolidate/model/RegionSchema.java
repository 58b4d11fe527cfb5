package hydromet.gwlevel.consolidate.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Column layout expected from one region's files.
 *
 * Bound from {@code consolidation.default-schema.*} and
 * {@code consolidation.regions.<code>.*}. Header names are compared trimmed
 * and case-insensitively.
 */
@Data
public class RegionSchema {

    private String dateColumn = "Date";
    private String regionColumn = "State";
    private String districtColumn = "District";
    private String stationColumn = "Station_name";
    private String levelColumn = "level";

    /** Used when {@link #levelColumn} is absent: first header containing this text. */
    private String levelColumnHint = "level";

    private boolean regionColumnRequired = true;
    private boolean districtColumnRequired = true;

    /**
     * Locate every schema column in the given header row.
     */
    public ColumnLayout resolve(List<String> headers) {
        List<String> missing = new ArrayList<>();

        int date = indexOf(headers, dateColumn);
        if (date < 0) {
            missing.add(dateColumn);
        }
        int station = indexOf(headers, stationColumn);
        if (station < 0) {
            missing.add(stationColumn);
        }
        int level = indexOf(headers, levelColumn);
        if (level < 0) {
            level = indexContaining(headers, levelColumnHint);
        }
        if (level < 0) {
            missing.add(levelColumn);
        }
        int region = indexOf(headers, regionColumn);
        if (region < 0 && regionColumnRequired) {
            missing.add(regionColumn);
        }
        int district = indexOf(headers, districtColumn);
        if (district < 0 && districtColumnRequired) {
            missing.add(districtColumn);
        }

        return new ColumnLayout(date, region, district, station, level, missing);
    }

    private static int indexOf(List<String> headers, String name) {
        if (name == null || name.isBlank()) {
            return -1;
        }
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).trim().equalsIgnoreCase(name.trim())) {
                return i;
            }
        }
        return -1;
    }

    private static int indexContaining(List<String> headers, String hint) {
        if (hint == null || hint.isBlank()) {
            return -1;
        }
        String needle = hint.toLowerCase(Locale.ROOT);
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).toLowerCase(Locale.ROOT).contains(needle)) {
                return i;
            }
        }
        return -1;
    }
}
