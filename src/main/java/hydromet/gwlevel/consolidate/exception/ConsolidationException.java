package hydromet.gwlevel.consolidate.exception;

/**
 * Base type for every failure raised by the consolidation pipeline.
 */
public class ConsolidationException extends RuntimeException {

    public ConsolidationException(String message) {
        super(message);
    }

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
