package hydromet.gwlevel.consolidate.model;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Accept/reject decision for one raw file. Created once, never mutated.
 */
@Getter
@ToString
public final class ValidationVerdict {

    public enum Outcome {
        ACCEPTED,
        REJECTED_EMPTY,
        REJECTED_MISSING_COLUMNS,
        REJECTED_PLACEHOLDER,
        REJECTED_OTHER
    }

    private final String fileId;
    private final String regionCode;
    private final Outcome outcome;
    private final String reason;
    private final LocalDateTime timestamp;

    private ValidationVerdict(String fileId, String regionCode, Outcome outcome, String reason) {
        this.fileId = fileId;
        this.regionCode = regionCode;
        this.outcome = outcome;
        this.reason = reason;
        this.timestamp = LocalDateTime.now();
    }

    public static ValidationVerdict accepted(RawFile file, String reason) {
        return new ValidationVerdict(file.getFileId(), file.getRegionCode(), Outcome.ACCEPTED, reason);
    }

    public static ValidationVerdict rejected(String fileId, String regionCode, Outcome outcome, String reason) {
        if (outcome == Outcome.ACCEPTED) {
            throw new IllegalArgumentException("A rejection needs a rejected outcome");
        }
        return new ValidationVerdict(fileId, regionCode, outcome, reason);
    }

    public static ValidationVerdict rejected(RawFile file, Outcome outcome, String reason) {
        return rejected(file.getFileId(), file.getRegionCode(), outcome, reason);
    }

    public boolean isAccepted() {
        return outcome == Outcome.ACCEPTED;
    }
}
