package in.optiontick.domain.data;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted tick for one instrument.
 *
 * The timestamp is the ingestion instant at microsecond precision. Absent feed
 * values are stored as 0.0 (defaulted by the decoder).
 */
public record Observation(
    Instant timestamp,
    String instrumentKey,
    double lastPrice,
    double prevClose,
    double openInterest,
    double impliedVol,
    double delta,
    double gamma,
    double vega,
    double theta
) {
    public Observation {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(instrumentKey, "instrumentKey");
    }

    /**
     * Percent change of last price against previous close.
     */
    public double changePercent() {
        return PriceChange.percent(lastPrice, prevClose);
    }
}
