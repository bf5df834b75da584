package fr.imt.scanzilla.scanzilla.exception;

/**
 * Exception thrown when repository contents cannot be read from the hosting API.
 */
public class RepositoryFetchException extends ScanzillaException {

    private static final String ERROR_CODE = "FETCH_ERR";

    public RepositoryFetchException(String repository, String reason) {
        super(ERROR_CODE, "Failed to fetch repository " + repository + ": " + reason);
    }

    public RepositoryFetchException(String repository, String reason, Throwable cause) {
        super(ERROR_CODE, "Failed to fetch repository " + repository + ": " + reason, cause);
    }
}
