package in.optiontick.infrastructure.feed;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of decoding one feed message.
 *
 * {@link Kind#TICKS} frames carry per-instrument fields; {@link Kind#MARKET_STATUS}
 * frames carry segment statuses and no ticks.
 *
 * @param frameType      wire frame type (initial_feed, live_feed, market_info, or the raw number)
 * @param currentTs      server timestamp in epoch millis, 0 when absent
 * @param skippedEntries instrument entries that could not be mapped
 */
public record DecodedFrame(
    Kind kind,
    String frameType,
    long currentTs,
    Map<String, FeedFields> feeds,
    Map<String, String> segmentStatus,
    int skippedEntries
) {
    public enum Kind { TICKS, MARKET_STATUS }

    public static DecodedFrame ticks(String frameType, long currentTs,
                                     Map<String, FeedFields> feeds, int skippedEntries) {
        return new DecodedFrame(Kind.TICKS, frameType, currentTs,
            Collections.unmodifiableMap(new LinkedHashMap<>(feeds)), Map.of(), skippedEntries);
    }

    public static DecodedFrame marketStatus(String frameType, long currentTs, Map<String, String> segmentStatus) {
        return new DecodedFrame(Kind.MARKET_STATUS, frameType, currentTs,
            Map.of(), Collections.unmodifiableMap(new LinkedHashMap<>(segmentStatus)), 0);
    }
}
