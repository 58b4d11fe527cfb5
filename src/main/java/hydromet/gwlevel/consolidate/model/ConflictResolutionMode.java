package hydromet.gwlevel.consolidate.model;

/**
 * How the region consolidator settles two different values for the same (date, station).
 */
public enum ConflictResolutionMode {
    /** Value from the file with the later coverage end wins; first-seen on a tie. */
    LATEST_COVERAGE_WINS,
    /** First-seen value always wins. */
    FIRST_SEEN_WINS,
    /** Any conflict fails the whole region. */
    FAIL_REGION
}
