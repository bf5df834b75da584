package fr.imt.scanzilla.scanzilla.exception;

/**
 * Base exception class for all Scanzilla domain exceptions.
 * Carries an error code used in API responses and logs.
 */
public class ScanzillaException extends RuntimeException {

    private final String errorCode;

    public ScanzillaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ScanzillaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
