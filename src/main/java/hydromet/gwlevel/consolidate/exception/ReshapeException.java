package hydromet.gwlevel.consolidate.exception;

/**
 * An accepted file could not be pivoted. Treated as a late validation failure:
 * the file is skipped and the batch continues.
 */
public class ReshapeException extends ConsolidationException {

    private final String fileId;

    public ReshapeException(String fileId, String message) {
        super(message);
        this.fileId = fileId;
    }

    public ReshapeException(String fileId, String message, Throwable cause) {
        super(message, cause);
        this.fileId = fileId;
    }

    public String getFileId() {
        return fileId;
    }
}
