package in.optiontick.service.query;

/**
 * Exception thrown when query arguments are malformed (inverted window,
 * non-positive lookback, blank instrument key, unknown field).
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
