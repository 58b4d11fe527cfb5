package hydromet.gwlevel.consolidate.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Column positions of one file after resolving its header against a {@link RegionSchema}.
 * Optional columns that are absent have index -1.
 */
@Getter
@ToString
public final class ColumnLayout {

    private final int dateIndex;
    private final int regionIndex;
    private final int districtIndex;
    private final int stationIndex;
    private final int levelIndex;
    private final List<String> missingColumns;

    public ColumnLayout(int dateIndex, int regionIndex, int districtIndex, int stationIndex, int levelIndex,
                        List<String> missingColumns) {
        this.dateIndex = dateIndex;
        this.regionIndex = regionIndex;
        this.districtIndex = districtIndex;
        this.stationIndex = stationIndex;
        this.levelIndex = levelIndex;
        this.missingColumns = Collections.unmodifiableList(missingColumns);
    }

    public boolean isComplete() {
        return missingColumns.isEmpty();
    }
}
