package hydromet.gwlevel.consolidate.exception;

/**
 * Structural violation detected while building the national matrix.
 * Fatal to the whole run; no matrix is emitted as complete.
 */
public class MergeIntegrityException extends ConsolidationException {

    public MergeIntegrityException(String message) {
        super(message);
    }
}
