package villagecompute.weatherinsights.exceptions;

/**
 * Exception thrown when an external provider (weather data, text generation, embeddings) is unreachable, times out or
 * returns a server error.
 *
 * <p>
 * Retryable. The message is for logs only; callers surface a generic cause naming the provider instead of the provider's
 * own diagnostics.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
