package hydromet.gwlevel.consolidate.model;

import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One raw per-station file as handed over by the ingestion boundary.
 * Immutable; the content is never modified by any stage.
 */
@Getter
public final class RawFile {

    private final String regionCode;
    private final String fileId;
    private final byte[] content;
    private final String checksum;
    private final LocalDateTime receivedAt;

    // Coverage period announced by the filename, if it carries one
    private final LocalDate reportedPeriodStart;
    private final LocalDate reportedPeriodEnd;

    public RawFile(String regionCode, String fileId, byte[] content, String checksum,
                   LocalDateTime receivedAt, LocalDate reportedPeriodStart, LocalDate reportedPeriodEnd) {
        this.regionCode = Objects.requireNonNull(regionCode, "regionCode");
        this.fileId = Objects.requireNonNull(fileId, "fileId");
        this.content = content != null ? content.clone() : new byte[0];
        this.checksum = checksum;
        this.receivedAt = receivedAt != null ? receivedAt : LocalDateTime.now();
        this.reportedPeriodStart = reportedPeriodStart;
        this.reportedPeriodEnd = reportedPeriodEnd;
    }

    /**
     * Convenience for files without arrival metadata.
     */
    public static RawFile of(String regionCode, String fileId, byte[] content) {
        return new RawFile(regionCode, fileId, content, null, null, null, null);
    }

    public byte[] getContent() {
        return content.clone();
    }

    public long getSizeBytes() {
        return content.length;
    }

    @Override
    public String toString() {
        return "RawFile{region=" + regionCode + ", id=" + fileId + ", bytes=" + content.length + "}";
    }
}
