package fr.imt.scanzilla.scanzilla.exception;

/**
 * Exception thrown when a fragment is not among the recommendations of a repository.
 */
public class RecommendationNotFoundException extends ScanzillaException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public RecommendationNotFoundException(String repository, String fragmentId) {
        super(ERROR_CODE, "No recommendation with fragment " + fragmentId + " for repository " + repository);
    }

    public RecommendationNotFoundException(String repository, String fragmentId, String reason) {
        super(ERROR_CODE, "No recommendation with fragment " + fragmentId + " for repository " + repository + ": " + reason);
    }
}
