package in.optiontick.infrastructure.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.UUID;

/**
 * Subscription control message, sent once per connection as a binary frame:
 * <pre>
 * {"guid": "...", "method": "sub", "data": {"mode": "full", "instrumentKeys": [...]}}
 * </pre>
 */
public record FeedSubscription(String guid, String method, Data data) {

    public record Data(String mode, List<String> instrumentKeys) {
    }

    /**
     * A subscribe request with a fresh guid.
     */
    public static FeedSubscription subscribe(String mode, List<String> instrumentKeys) {
        return new FeedSubscription(UUID.randomUUID().toString(), "sub", new Data(mode, List.copyOf(instrumentKeys)));
    }

    public ByteBuffer toBinary(ObjectMapper objectMapper) {
        try {
            return ByteBuffer.wrap(objectMapper.writeValueAsBytes(this));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize subscription " + guid, e);
        }
    }
}
