package villagecompute.weatherinsights.exceptions;

/**
 * Exception thrown when text-generation output does not satisfy the recommendation contract (unparseable JSON, missing
 * required fields, out-of-enum priority or timing).
 *
 * <p>
 * Never reaches API callers: the synthesizer recovers with a deterministic fallback recommendation.
 */
public class SchemaViolationException extends RuntimeException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
