package fr.imt.scanzilla.scanzilla.exception;

public class BatchNotFoundException extends ScanzillaException {

    private static final String ERROR_CODE = "NOT_FOUND";

    public BatchNotFoundException(String batchId) {
        super(ERROR_CODE, "Analysis batch not found with ID: " + batchId);
    }
}
