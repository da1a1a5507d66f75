package in.optiontick.infrastructure.feed;

/**
 * Exception thrown when the feed socket fails to open or drops with an error.
 */
public class FeedConnectionException extends RuntimeException {

    private final String endpoint;

    public FeedConnectionException(String endpoint, String message) {
        super(String.format("[UPSTOX:%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public FeedConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[UPSTOX:%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
