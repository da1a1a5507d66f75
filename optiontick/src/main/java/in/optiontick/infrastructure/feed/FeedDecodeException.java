package in.optiontick.infrastructure.feed;

/**
 * Exception thrown when a binary feed message is not a well-formed frame.
 */
public class FeedDecodeException extends RuntimeException {

    private final int frameSize;

    public FeedDecodeException(int frameSize, String message, Throwable cause) {
        super(String.format("[UPSTOX:decode] %s (%d bytes)", message, frameSize), cause);
        this.frameSize = frameSize;
    }

    public int getFrameSize() {
        return frameSize;
    }
}
