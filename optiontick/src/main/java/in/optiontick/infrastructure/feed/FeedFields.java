package in.optiontick.infrastructure.feed;

import in.optiontick.domain.data.Observation;

import java.time.Instant;

/**
 * Numeric fields extracted from one instrument's feed entry. Absent values are 0.0.
 */
public record FeedFields(
    double lastPrice,
    double prevClose,
    double openInterest,
    double impliedVol,
    double delta,
    double gamma,
    double vega,
    double theta
) {
    public static final FeedFields EMPTY = new FeedFields(0, 0, 0, 0, 0, 0, 0, 0);

    public Observation toObservation(String instrumentKey, Instant timestamp) {
        return new Observation(timestamp, instrumentKey,
            lastPrice, prevClose, openInterest, impliedVol, delta, gamma, vega, theta);
    }
}
