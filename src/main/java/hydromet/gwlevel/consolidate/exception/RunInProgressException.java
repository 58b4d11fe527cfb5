package hydromet.gwlevel.consolidate.exception;

/**
 * A run was requested while another consolidation run is still active.
 */
public class RunInProgressException extends ConsolidationException {

    public RunInProgressException(String message) {
        super(message);
    }
}
