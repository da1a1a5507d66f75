package in.optiontick.domain.data;

import java.time.Instant;

/**
 * One point of a field's time series.
 */
public record SeriesPoint(Instant timestamp, double value) {
}
