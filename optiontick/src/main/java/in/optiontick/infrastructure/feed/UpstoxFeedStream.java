package in.optiontick.infrastructure.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket transport for the Upstox market data stream, on the JDK HttpClient.
 *
 * Fragments are accumulated until the last part of a message arrives; the whole
 * message is handed to the listener before the next one is requested.
 */
public final class UpstoxFeedStream implements FeedTransport {
    private static final Logger log = LoggerFactory.getLogger(UpstoxFeedStream.class);

    private static final int INITIAL_BUFFER_SIZE = 64 * 1024;

    private final HttpClient httpClient;

    public UpstoxFeedStream(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<FeedSession> connect(URI endpoint, FrameListener listener) {
        log.info("[UPSTOX] Opening feed socket to {}://{}{}", endpoint.getScheme(), endpoint.getHost(), endpoint.getPath());

        return httpClient.newWebSocketBuilder()
            .buildAsync(endpoint, new StreamListener(listener))
            .thenApply(WebSocketSession::new);
    }

    private static final class WebSocketSession implements FeedSession {
        private final WebSocket webSocket;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        WebSocketSession(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public CompletableFuture<Void> sendBinary(ByteBuffer message) {
            return webSocket.sendBinary(message, true).thenApply(ws -> null);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true) && !webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client shutdown")
                    .exceptionally(e -> {
                        log.warn("[UPSTOX] Close handshake failed, aborting socket: {}", e.getMessage());
                        webSocket.abort();
                        return null;
                    });
            }
        }
    }

    private static final class StreamListener implements WebSocket.Listener {
        private final FrameListener listener;
        private ByteBuffer messageBuffer = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);

        StreamListener(FrameListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("[UPSTOX] ✅ Feed socket handshake successful");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            // The feed is binary; text frames are server notices.
            if (last) {
                log.debug("[UPSTOX] Text message: {}", data);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            append(data);
            if (last) {
                messageBuffer.flip();
                ByteBuffer message = ByteBuffer.allocate(messageBuffer.remaining());
                message.put(messageBuffer).flip();
                messageBuffer.clear();
                listener.onFrame(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[UPSTOX] Feed socket error: {}", error.getMessage());
            listener.onError(error);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("[UPSTOX] Feed socket closed: {} - {}", statusCode, reason);
            listener.onClosed(statusCode, reason);
            return null;
        }

        private void append(ByteBuffer data) {
            if (messageBuffer.remaining() < data.remaining()) {
                int needed = messageBuffer.position() + data.remaining();
                ByteBuffer grown = ByteBuffer.allocate(Math.max(needed, messageBuffer.capacity() * 2));
                messageBuffer.flip();
                grown.put(messageBuffer);
                messageBuffer = grown;
            }
            messageBuffer.put(data);
        }
    }
}
