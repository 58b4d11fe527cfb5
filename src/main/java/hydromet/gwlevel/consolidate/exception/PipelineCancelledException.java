package hydromet.gwlevel.consolidate.exception;

public class PipelineCancelledException extends ConsolidationException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
