package villagecompute.weatherinsights.exceptions;

/**
 * Exception thrown when a location cannot be resolved to coordinates (unknown name, out-of-range coordinates).
 *
 * <p>
 * Fatal for the single request that raised it and never retried. Mapped to HTTP 404 Not Found in REST resources.
 */
public class InvalidLocationException extends RuntimeException {

    public InvalidLocationException(String message) {
        super(message);
    }

    public InvalidLocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
