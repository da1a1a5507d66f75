package in.optiontick.config;

import in.optiontick.util.Env;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for ingestion, storage and the query HTTP surface.
 *
 * All values come from {@link Env}; see {@link #fromEnv()} for keys and defaults.
 * {@code registryPath} is a directory of chain files ({@code <underlying>-<DD>-<MM>-<YYYY>.json})
 * or a single chain file.
 */
public record FeedConfig(
    RunMode runMode,
    String accessToken,
    String authorizeUrl,
    String feedMode,
    Path registryPath,
    Path storePath,
    int storePoolSize,
    int storeBusyTimeoutMs,
    int writerMaxInFlight,
    long writerOfferTimeoutMs,
    long writerShutdownTimeoutMs,
    int httpPort,
    int connectTimeoutSeconds
) {
    public static final String DEFAULT_AUTHORIZE_URL =
        "https://api.upstox.com/v3/feed/market-data-feed/authorize";

    /**
     * Which halves of the service to start.
     */
    public enum RunMode {
        /** Ingest the feed and serve queries. */
        FULL,
        /** Ingest only; no HTTP surface. */
        INGEST,
        /** Serve queries over an existing store. */
        QUERY;

        public boolean ingests() {
            return this != QUERY;
        }

        public static RunMode parse(String value) {
            try {
                return RunMode.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown RUN_MODE: " + value, e);
            }
        }
    }

    public static FeedConfig fromEnv() {
        return new FeedConfig(
            RunMode.parse(Env.get("RUN_MODE", "FULL")),
            Env.firstOf(null, "UPSTOX_ACCESS_TOKEN", "A_TOKEN"),
            Env.get("FEED_AUTHORIZE_URL", DEFAULT_AUTHORIZE_URL),
            Env.get("FEED_MODE", "full"),
            Path.of(Env.firstOf("resources", "INSTRUMENT_REGISTRY_DIR", "INSTRUMENT_REGISTRY_FILE")),
            Path.of(Env.get("STORE_PATH", "resources/live_data.db")),
            Env.getInt("STORE_POOL_SIZE", 4),
            Env.getInt("STORE_BUSY_TIMEOUT_MS", 2000),
            Env.getInt("WRITER_MAX_IN_FLIGHT", 256),
            Env.getLong("WRITER_OFFER_TIMEOUT_MS", 50),
            Env.getLong("WRITER_SHUTDOWN_TIMEOUT_MS", 5000),
            Env.getInt("HTTP_PORT", 9090),
            Env.getInt("CONNECT_TIMEOUT_SECONDS", 10)
        );
    }

    public boolean httpEnabled() {
        return runMode != RunMode.INGEST && httpPort > 0;
    }

    public Duration writerOfferTimeout() {
        return Duration.ofMillis(writerOfferTimeoutMs);
    }

    public Duration writerShutdownTimeout() {
        return Duration.ofMillis(writerShutdownTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(connectTimeoutSeconds);
    }

    /**
     * Problems that prevent startup; empty when the config is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (runMode.ingests() && (accessToken == null || accessToken.isBlank())) {
            errors.add("UPSTOX_ACCESS_TOKEN (or A_TOKEN) is required to ingest");
        }
        if (runMode.ingests() && !"full".equals(feedMode) && !"ltpc".equals(feedMode)
                && !"option_greeks".equals(feedMode) && !"full_d30".equals(feedMode)) {
            errors.add("FEED_MODE must be one of full, ltpc, option_greeks, full_d30: " + feedMode);
        }
        if (storePoolSize < 1) errors.add("STORE_POOL_SIZE must be >= 1");
        if (storeBusyTimeoutMs < 0) errors.add("STORE_BUSY_TIMEOUT_MS must be >= 0");
        if (writerMaxInFlight < 1) errors.add("WRITER_MAX_IN_FLIGHT must be >= 1");
        if (writerOfferTimeoutMs < 0) errors.add("WRITER_OFFER_TIMEOUT_MS must be >= 0");
        if (httpPort < 0 || httpPort > 65535) errors.add("HTTP_PORT out of range: " + httpPort);
        if (runMode == RunMode.QUERY && httpPort == 0) {
            errors.add("RUN_MODE=QUERY needs an HTTP_PORT; port 0 disables the only surface it runs");
        }
        if (connectTimeoutSeconds < 1) errors.add("CONNECT_TIMEOUT_SECONDS must be >= 1");
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }
}
