package in.optiontick.service.query;

import in.optiontick.domain.data.FieldName;
import in.optiontick.domain.data.SeriesPoint;
import in.optiontick.domain.data.TimeWindow;
import in.optiontick.domain.repository.TickRepository;
import in.optiontick.infrastructure.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Time series of one field for one instrument, ascending by timestamp.
 */
public final class RangeQueryService {
    private static final Logger log = LoggerFactory.getLogger(RangeQueryService.class);

    private final TickRepository repository;
    private final WindowResolver windowResolver;
    private final FeedMetrics metrics;

    public RangeQueryService(TickRepository repository, WindowResolver windowResolver, FeedMetrics metrics) {
        this.repository = repository;
        this.windowResolver = windowResolver;
        this.metrics = metrics;
    }

    /**
     * @return points within the resolved window; empty when nothing matches
     * @throws InvalidQueryException on a blank key, missing field or invalid window
     */
    public List<SeriesPoint> range(String instrumentKey, FieldName field, TimeWindow window) {
        if (instrumentKey == null || instrumentKey.isBlank()) {
            throw new InvalidQueryException("Instrument key is required");
        }
        if (field == null) {
            throw new InvalidQueryException("Field is required");
        }
        WindowResolver.Bounds bounds = windowResolver.resolve(window);

        long t0 = System.nanoTime();
        List<SeriesPoint> points = repository.findSeries(instrumentKey, field, bounds.start(), bounds.end());

        Duration took = Duration.ofNanos(System.nanoTime() - t0);
        metrics.recordQuery("range", took, points.size());
        log.debug("[QUERY] range {} {} {} -> {} points in {}ms",
            instrumentKey, field, window, points.size(), took.toMillis());
        return points;
    }
}
