package hydromet.gwlevel.consolidate.model;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * One region folder and the station files found in it, in sorted order.
 */
@Getter
@ToString
public final class RegionSource {

    private final String regionCode;
    private final Path folder;
    private final List<Path> files;

    public RegionSource(String regionCode, Path folder, List<Path> files) {
        this.regionCode = regionCode;
        this.folder = folder;
        this.files = Collections.unmodifiableList(files);
    }
}
