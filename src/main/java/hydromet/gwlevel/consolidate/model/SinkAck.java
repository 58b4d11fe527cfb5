package hydromet.gwlevel.consolidate.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Acknowledgement returned by a matrix sink once the output is in place.
 */
@Getter
@ToString
@AllArgsConstructor
public final class SinkAck {

    private final String location;
    private final int rowsWritten;
    private final int columnsWritten;
    private final long bytesWritten;
    private final String checksum;
}
