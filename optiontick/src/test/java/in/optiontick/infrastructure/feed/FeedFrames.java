package in.optiontick.infrastructure.feed;

import com.google.protobuf.CodedOutputStream;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Feed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FeedResponse;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.LTPC;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketFullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.OptionGreeks;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Type;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Builders for Upstox feed frames used across tests.
 */
public final class FeedFrames {

    public static Feed optionFeed(double ltp, double cp, double oi, double iv,
                                  double delta, double gamma, double vega, double theta) {
        return Feed.newBuilder()
            .setFullFeed(FullFeed.newBuilder()
                .setMarketFF(MarketFullFeed.newBuilder()
                    .setLtpc(LTPC.newBuilder().setLtp(ltp).setCp(cp))
                    .setOi(oi)
                    .setIv(iv)
                    .setOptionGreeks(OptionGreeks.newBuilder()
                        .setDelta(delta).setGamma(gamma).setVega(vega).setTheta(theta))))
            .build();
    }

    public static Feed priceOnlyFeed(double ltp, double cp) {
        return Feed.newBuilder()
            .setFullFeed(FullFeed.newBuilder()
                .setMarketFF(MarketFullFeed.newBuilder()
                    .setLtpc(LTPC.newBuilder().setLtp(ltp).setCp(cp))))
            .build();
    }

    public static byte[] liveFeed(Map<String, Feed> feeds) {
        return FeedResponse.newBuilder()
            .setType(Type.live_feed)
            .putAllFeeds(feeds)
            .setCurrentTs(1_736_480_700_000L)
            .build()
            .toByteArray();
    }

    /**
     * A frame with {@code valid} followed by one feeds entry whose value is truncated protobuf.
     */
    public static byte[] withCorruptEntry(byte[] valid, String corruptKey) {
        try {
            ByteArrayOutputStream entry = new ByteArrayOutputStream();
            CodedOutputStream entryOut = CodedOutputStream.newInstance(entry);
            entryOut.writeString(1, corruptKey);
            // Feed.ltpc claims 5 bytes but only one follows
            entryOut.writeByteArray(2, new byte[]{0x0A, 0x05, 0x01});
            entryOut.flush();

            ByteArrayOutputStream frame = new ByteArrayOutputStream();
            frame.write(valid);
            CodedOutputStream frameOut = CodedOutputStream.newInstance(frame);
            frameOut.writeByteArray(2, entry.toByteArray());
            frameOut.flush();
            return frame.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private FeedFrames() {}
}
