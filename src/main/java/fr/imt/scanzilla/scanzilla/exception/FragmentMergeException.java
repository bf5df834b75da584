package fr.imt.scanzilla.scanzilla.exception;

/**
 * Exception thrown when a template fragment cannot be spliced into a workflow.
 */
public class FragmentMergeException extends ScanzillaException {

    private static final String ERROR_CODE = "MERGE_ERR";

    public FragmentMergeException(String fragmentId, String reason) {
        super(ERROR_CODE, "Cannot merge fragment " + fragmentId + ": " + reason);
    }

    public FragmentMergeException(String fragmentId, String reason, Throwable cause) {
        super(ERROR_CODE, "Cannot merge fragment " + fragmentId + ": " + reason, cause);
    }
}
