package in.optiontick.infrastructure.feed;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * Message-oriented connection to the market data stream.
 *
 * Implementations deliver complete messages to the {@link FrameListener} one at a
 * time, on a single thread, and request the next message only after
 * {@link FrameListener#onFrame} returns.
 */
public interface FeedTransport {

    /**
     * Open a connection to {@code endpoint}. The future fails if the handshake fails.
     */
    CompletableFuture<FeedSession> connect(URI endpoint, FrameListener listener);

    /**
     * An open connection.
     */
    interface FeedSession {

        CompletableFuture<Void> sendBinary(ByteBuffer message);

        /**
         * Close with a normal-closure status. Idempotent.
         */
        void close();
    }

    /**
     * Callbacks for inbound traffic.
     */
    interface FrameListener {

        void onFrame(ByteBuffer frame);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }
}
