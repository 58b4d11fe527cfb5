package hydromet.gwlevel.consolidate.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * End-to-end lifecycle of one file. Only forward transitions exist; a
 * corrected file re-enters as a new raw file.
 */
public enum FileStage {
    INGESTED,
    VALIDATED_ACCEPTED,
    VALIDATED_REJECTED,
    RESHAPED,
    RESHAPE_FAILED,
    CONSOLIDATED_INTO_REGION,
    MERGED_INTO_NATIONAL;

    /**
     * Stages a file may move to from this one.
     */
    public Set<FileStage> successors() {
        switch (this) {
            case INGESTED:
                return EnumSet.of(VALIDATED_ACCEPTED, VALIDATED_REJECTED);
            case VALIDATED_ACCEPTED:
                return EnumSet.of(RESHAPED, RESHAPE_FAILED);
            case RESHAPED:
                return EnumSet.of(CONSOLIDATED_INTO_REGION);
            case CONSOLIDATED_INTO_REGION:
                return EnumSet.of(MERGED_INTO_NATIONAL);
            default:
                return EnumSet.noneOf(FileStage.class);
        }
    }

    public boolean canAdvanceTo(FileStage next) {
        return successors().contains(next);
    }

    /**
     * First stage a file may be recorded at. Validation may be the first event
     * for files that were never announced as ingested.
     */
    public static boolean isEntryStage(FileStage stage) {
        return stage == INGESTED || stage == VALIDATED_ACCEPTED || stage == VALIDATED_REJECTED;
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
