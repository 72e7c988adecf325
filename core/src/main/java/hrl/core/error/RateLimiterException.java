package hrl.core.error;

/**
 * Base class for every error raised by the rate limiter.
 * Catching this catches all library-specific failures.
 */
public class RateLimiterException extends RuntimeException {

    public RateLimiterException(String message) {
        super(message);
    }

    public RateLimiterException(String message, Throwable cause) {
        super(message, cause);
    }
}
