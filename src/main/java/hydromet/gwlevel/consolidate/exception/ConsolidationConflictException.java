package hydromet.gwlevel.consolidate.exception;

import hydromet.gwlevel.consolidate.model.ConsolidationConflict;

/**
 * Raised only in FAIL_REGION mode: the region is dropped from the run.
 */
public class ConsolidationConflictException extends ConsolidationException {

    private final ConsolidationConflict conflict;

    public ConsolidationConflictException(ConsolidationConflict conflict) {
        super(String.format("Conflicting values for %s on %s in region %s: %s (%s) vs %s (%s)",
                conflict.getStationId(), conflict.getDate(), conflict.getRegionCode(),
                conflict.getKeptValue(), conflict.getKeptFileId(),
                conflict.getDiscardedValue(), conflict.getDiscardedFileId()));
        this.conflict = conflict;
    }

    public ConsolidationConflict getConflict() {
        return conflict;
    }
}
