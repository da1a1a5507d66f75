package in.optiontick.infrastructure.feed;

/**
 * Exception thrown when the feed authorize call does not yield a stream endpoint.
 */
public class FeedAuthenticationException extends RuntimeException {

    private final int statusCode;

    public FeedAuthenticationException(int statusCode, String message) {
        super(String.format("[UPSTOX:authorize] %s (HTTP %d)", message, statusCode));
        this.statusCode = statusCode;
    }

    public FeedAuthenticationException(int statusCode, String message, Throwable cause) {
        super(String.format("[UPSTOX:authorize] %s (HTTP %d)", message, statusCode), cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the authorize response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
