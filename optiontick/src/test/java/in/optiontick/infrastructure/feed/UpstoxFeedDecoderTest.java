package in.optiontick.infrastructure.feed;

import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Feed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FeedResponse;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FirstLevelWithGreeks;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.IndexFullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.LTPC;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketFullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketInfo;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketStatus;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.OptionGreeks;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Type;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static in.optiontick.infrastructure.feed.FeedFrames.liveFeed;
import static in.optiontick.infrastructure.feed.FeedFrames.optionFeed;
import static in.optiontick.infrastructure.feed.FeedFrames.priceOnlyFeed;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpstoxFeedDecoderTest {

    private final UpstoxFeedDecoder decoder = new UpstoxFeedDecoder();

    @Test
    void decode_returnsOneEntryPerInstrumentKey() {
        Map<String, Feed> feeds = new LinkedHashMap<>();
        feeds.put("NSE_FO|45450", optionFeed(110.5, 102.9, 1200, 14.2, 0.52, 0.001, 12.1, -8.4));
        feeds.put("NSE_FO|45451", optionFeed(98.0, 101.0, 900, 15.0, -0.48, 0.001, 11.9, -7.9));
        feeds.put("NSE_FO|45452", priceOnlyFeed(5.0, 4.0));

        DecodedFrame frame = decoder.decode(liveFeed(feeds));

        assertEquals(DecodedFrame.Kind.TICKS, frame.kind());
        assertEquals(3, frame.feeds().size(), "One field bag per instrument key");
        assertEquals(feeds.keySet(), frame.feeds().keySet());
        assertEquals("live_feed", frame.frameType());
        assertEquals(1_736_480_700_000L, frame.currentTs());
        assertEquals(0, frame.skippedEntries());
    }

    @Test
    void decode_mapsFullFeedFields() {
        byte[] bytes = liveFeed(Map.of("NSE_FO|45450",
            optionFeed(110.5, 102.9, 1200, 14.2, 0.52, 0.0012, 12.1, -8.4)));

        FeedFields fields = decoder.decode(bytes).feeds().get("NSE_FO|45450");

        assertEquals(110.5, fields.lastPrice());
        assertEquals(102.9, fields.prevClose());
        assertEquals(1200, fields.openInterest());
        assertEquals(14.2, fields.impliedVol());
        assertEquals(0.52, fields.delta());
        assertEquals(0.0012, fields.gamma());
        assertEquals(12.1, fields.vega());
        assertEquals(-8.4, fields.theta());
    }

    @Test
    void decode_isDeterministic() {
        byte[] bytes = liveFeed(Map.of(
            "NSE_FO|1", optionFeed(1, 2, 3, 4, 5, 6, 7, 8),
            "NSE_FO|2", priceOnlyFeed(9, 10)));

        assertEquals(decoder.decode(bytes), decoder.decode(bytes));
        assertEquals(decoder.decode(bytes), decoder.decode(ByteBuffer.wrap(bytes)));
    }

    @Test
    void decode_missingGreeksDefaultToZeroWithoutDroppingSiblings() {
        Map<String, Feed> feeds = new LinkedHashMap<>();
        feeds.put("NSE_FO|A", optionFeed(100, 90, 10, 11, 0.5, 0.01, 2, -3));
        feeds.put("NSE_FO|B", priceOnlyFeed(50, 40));

        DecodedFrame frame = decoder.decode(liveFeed(feeds));

        FeedFields noGreeks = frame.feeds().get("NSE_FO|B");
        assertEquals(50, noGreeks.lastPrice());
        assertEquals(0.0, noGreeks.delta());
        assertEquals(0.0, noGreeks.gamma());
        assertEquals(0.0, noGreeks.vega());
        assertEquals(0.0, noGreeks.theta());
        assertEquals(0.0, noGreeks.openInterest());
        assertEquals(0.5, frame.feeds().get("NSE_FO|A").delta(), "Sibling entry keeps its greeks");
    }

    @Test
    void decode_feedWithoutAnyBlockIsAllZeros() {
        byte[] bytes = liveFeed(Map.of("NSE_FO|EMPTY", Feed.getDefaultInstance()));

        assertEquals(FeedFields.EMPTY, decoder.decode(bytes).feeds().get("NSE_FO|EMPTY"));
    }

    @Test
    void decode_malformedEntryIsSkippedAndCounted() {
        byte[] valid = liveFeed(Map.of(
            "NSE_FO|1", optionFeed(1, 2, 3, 4, 5, 6, 7, 8),
            "NSE_FO|2", priceOnlyFeed(9, 10)));
        byte[] bytes = FeedFrames.withCorruptEntry(valid, "NSE_FO|BAD");

        DecodedFrame frame = decoder.decode(bytes);

        assertEquals(2, frame.feeds().size(), "Valid entries survive a corrupt sibling");
        assertFalse(frame.feeds().containsKey("NSE_FO|BAD"));
        assertEquals(1, frame.skippedEntries());
    }

    @Test
    void decode_emptyFrameYieldsEmptyMap() {
        DecodedFrame frame = decoder.decode(new byte[0]);

        assertEquals(DecodedFrame.Kind.TICKS, frame.kind());
        assertTrue(frame.feeds().isEmpty());
    }

    @Test
    void decode_garbageThrowsFeedDecodeException() {
        byte[] truncated = {0x12, 0x0A, 0x01};
        byte[] text = "{\"not\":\"protobuf\"}".getBytes(StandardCharsets.UTF_8);

        FeedDecodeException e = assertThrows(FeedDecodeException.class, () -> decoder.decode(truncated));
        assertEquals(3, e.getFrameSize());
        assertThrows(FeedDecodeException.class, () -> decoder.decode(text));
    }

    @Test
    void decode_marketInfoIsClassifiedAsMarketStatus() {
        byte[] bytes = FeedResponse.newBuilder()
            .setType(Type.market_info)
            .setMarketInfo(MarketInfo.newBuilder()
                .putSegmentStatus("NSE_FO", MarketStatus.NORMAL_OPEN)
                .putSegmentStatus("NSE_EQ", MarketStatus.PRE_OPEN_END))
            .setCurrentTs(42L)
            .build()
            .toByteArray();

        DecodedFrame frame = decoder.decode(bytes);

        assertEquals(DecodedFrame.Kind.MARKET_STATUS, frame.kind());
        assertTrue(frame.feeds().isEmpty(), "Status notices carry no ticks");
        assertEquals("NORMAL_OPEN", frame.segmentStatus().get("NSE_FO"));
        assertEquals("PRE_OPEN_END", frame.segmentStatus().get("NSE_EQ"));
        assertEquals(42L, frame.currentTs());
    }

    @Test
    void decode_mapsIndexGreeksModeAndBareLtpcFeeds() {
        Map<String, Feed> feeds = new LinkedHashMap<>();
        feeds.put("NSE_INDEX|Nifty 50", Feed.newBuilder()
            .setFullFeed(FullFeed.newBuilder()
                .setIndexFF(IndexFullFeed.newBuilder().setLtpc(LTPC.newBuilder().setLtp(23500).setCp(23400))))
            .build());
        feeds.put("NSE_FO|G", Feed.newBuilder()
            .setFirstLevelWithGreeks(FirstLevelWithGreeks.newBuilder()
                .setLtpc(LTPC.newBuilder().setLtp(12).setCp(10))
                .setOi(500)
                .setIv(18.5)
                .setOptionGreeks(OptionGreeks.newBuilder().setDelta(0.3)))
            .build());
        feeds.put("NSE_FO|L", Feed.newBuilder().setLtpc(LTPC.newBuilder().setLtp(7).setCp(8)).build());

        DecodedFrame frame = decoder.decode(liveFeed(feeds));

        assertEquals(23500, frame.feeds().get("NSE_INDEX|Nifty 50").lastPrice());
        assertEquals(0.0, frame.feeds().get("NSE_INDEX|Nifty 50").openInterest());
        assertEquals(18.5, frame.feeds().get("NSE_FO|G").impliedVol());
        assertEquals(0.3, frame.feeds().get("NSE_FO|G").delta());
        assertEquals(8, frame.feeds().get("NSE_FO|L").prevClose());
    }

    @Test
    void decode_nonFiniteValuesCoerceToZero() {
        Feed feed = Feed.newBuilder()
            .setFullFeed(FullFeed.newBuilder()
                .setMarketFF(MarketFullFeed.newBuilder()
                    .setLtpc(LTPC.newBuilder().setLtp(Double.NaN).setCp(10))
                    .setIv(Double.POSITIVE_INFINITY)))
            .build();

        FeedFields fields = decoder.decode(liveFeed(Map.of("NSE_FO|X", feed))).feeds().get("NSE_FO|X");

        assertEquals(0.0, fields.lastPrice());
        assertEquals(0.0, fields.impliedVol());
        assertEquals(10, fields.prevClose());
    }
}
