package in.optiontick.infrastructure.feed;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Feed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FirstLevelWithGreeks;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.FullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.LTPC;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketFullFeed;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketInfo;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.MarketStatus;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.OptionGreeks;
import in.optiontick.infrastructure.feed.proto.MarketDataFeedV3.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes Upstox v3 {@code FeedResponse} messages.
 *
 * The top level of the message is walked field by field so that every entry of
 * the {@code feeds} map is parsed on its own: a corrupt entry is skipped and
 * counted, the rest of the frame still decodes. Only a frame whose top level is
 * not valid protobuf fails as a whole.
 *
 * Stateless and thread-safe.
 */
public final class UpstoxFeedDecoder {
    private static final Logger log = LoggerFactory.getLogger(UpstoxFeedDecoder.class);

    // FeedResponse field numbers
    private static final int FIELD_TYPE = 1;
    private static final int FIELD_FEEDS = 2;
    private static final int FIELD_CURRENT_TS = 3;
    private static final int FIELD_MARKET_INFO = 4;

    // map entry field numbers
    private static final int ENTRY_KEY = 1;
    private static final int ENTRY_VALUE = 2;

    public DecodedFrame decode(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.duplicate().get(bytes);
        return decode(bytes);
    }

    public DecodedFrame decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");

        int typeNumber = 0;
        long currentTs = 0;
        MarketInfo.Builder marketInfo = null;
        Map<String, FeedFields> feeds = new LinkedHashMap<>();
        int skipped = 0;

        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            while (true) {
                int tag = in.readTag();
                if (tag == 0) {
                    break;
                }
                int field = tag >>> 3;
                int wireType = tag & 0x7;

                if (field == FIELD_TYPE && wireType == WireFormat.WIRETYPE_VARINT) {
                    typeNumber = in.readEnum();
                } else if (field == FIELD_FEEDS && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    if (!decodeEntry(in.readBytes(), feeds)) {
                        skipped++;
                    }
                } else if (field == FIELD_CURRENT_TS && wireType == WireFormat.WIRETYPE_VARINT) {
                    currentTs = in.readInt64();
                } else if (field == FIELD_MARKET_INFO && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    if (marketInfo == null) {
                        marketInfo = MarketInfo.newBuilder();
                    }
                    marketInfo.mergeFrom(in.readBytes());
                } else if (!in.skipField(tag)) {
                    break;
                }
            }
        } catch (InvalidProtocolBufferException e) {
            throw new FeedDecodeException(bytes.length, "Malformed feed frame: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FeedDecodeException(bytes.length, "Unreadable feed frame", e);
        }

        Type type = Type.forNumber(typeNumber);
        String frameType = type != null ? type.name() : String.valueOf(typeNumber);

        if (type == Type.market_info) {
            Map<String, String> status = new LinkedHashMap<>();
            if (marketInfo != null) {
                for (Map.Entry<String, MarketStatus> e : marketInfo.getSegmentStatusMap().entrySet()) {
                    status.put(e.getKey(), e.getValue().name());
                }
            }
            return DecodedFrame.marketStatus(frameType, currentTs, status);
        }

        return DecodedFrame.ticks(frameType, currentTs, feeds, skipped);
    }

    /**
     * Parses one {@code feeds} map entry into {@code into}. Returns false when the
     * entry is unusable.
     */
    private boolean decodeEntry(ByteString entry, Map<String, FeedFields> into) {
        String key = "";
        ByteString value = null;
        try {
            CodedInputStream in = entry.newCodedInput();
            while (true) {
                int tag = in.readTag();
                if (tag == 0) {
                    break;
                }
                int field = tag >>> 3;
                int wireType = tag & 0x7;
                if (field == ENTRY_KEY && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    key = in.readStringRequireUtf8();
                } else if (field == ENTRY_VALUE && wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                    value = in.readBytes();
                } else if (!in.skipField(tag)) {
                    break;
                }
            }

            if (key.isBlank()) {
                log.warn("[UPSTOX] Skipping feed entry without instrument key ({} bytes)", entry.size());
                return false;
            }

            Feed feed = value == null ? Feed.getDefaultInstance() : Feed.parseFrom(value);
            into.put(key, map(feed));
            return true;

        } catch (IOException e) {
            log.warn("[UPSTOX] Skipping malformed feed entry '{}': {}", key, e.getMessage());
            return false;
        }
    }

    static FeedFields map(Feed feed) {
        if (feed.hasFullFeed()) {
            FullFeed full = feed.getFullFeed();
            if (full.hasMarketFF()) {
                MarketFullFeed m = full.getMarketFF();
                return fields(m.getLtpc(), m.getOi(), m.getIv(), m.getOptionGreeks());
            }
            if (full.hasIndexFF()) {
                return fields(full.getIndexFF().getLtpc(), 0.0, 0.0, OptionGreeks.getDefaultInstance());
            }
            return FeedFields.EMPTY;
        }
        if (feed.hasFirstLevelWithGreeks()) {
            FirstLevelWithGreeks g = feed.getFirstLevelWithGreeks();
            return fields(g.getLtpc(), g.getOi(), g.getIv(), g.getOptionGreeks());
        }
        if (feed.hasLtpc()) {
            return fields(feed.getLtpc(), 0.0, 0.0, OptionGreeks.getDefaultInstance());
        }
        return FeedFields.EMPTY;
    }

    private static FeedFields fields(LTPC ltpc, double oi, double iv, OptionGreeks greeks) {
        return new FeedFields(
            finite(ltpc.getLtp()),
            finite(ltpc.getCp()),
            finite(oi),
            finite(iv),
            finite(greeks.getDelta()),
            finite(greeks.getGamma()),
            finite(greeks.getVega()),
            finite(greeks.getTheta())
        );
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
