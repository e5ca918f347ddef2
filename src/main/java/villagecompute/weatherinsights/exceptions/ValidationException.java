package villagecompute.weatherinsights.exceptions;

/**
 * Exception thrown when an insight request is malformed (blank location, unknown audience, empty or oversized batch).
 *
 * <p>
 * Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
