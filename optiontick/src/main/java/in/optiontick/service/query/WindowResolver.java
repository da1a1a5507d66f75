package in.optiontick.service.query;

import in.optiontick.domain.data.TimeWindow;
import in.optiontick.util.MonotonicMicros;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Turns a {@link TimeWindow} into concrete inclusive bounds.
 *
 * For "last n minutes" the reference instant is now when the date is today and
 * the session close (15:30 IST) for a past date. A whole day runs from midnight
 * IST to the end of the day, capped at now for today. Future dates are rejected.
 */
public final class WindowResolver {

    /**
     * Inclusive [start, end] bounds.
     */
    public record Bounds(Instant start, Instant end) {
    }

    private final Clock clock;

    public WindowResolver(Clock clock) {
        this.clock = clock;
    }

    public Bounds resolve(TimeWindow window) {
        if (window == null) {
            throw new InvalidQueryException("Time window is required");
        }
        Bounds bounds = switch (window.kind()) {
            case BETWEEN -> between(window.start(), window.end());
            case LAST_MINUTES -> lastMinutes(window.minutes(), window.date());
            case WHOLE_DAY -> wholeDay(window.date());
        };
        requireRepresentable(bounds.start(), bounds.end());
        return bounds;
    }

    public Bounds between(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidQueryException("Window start and end are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidQueryException("Window start " + start + " is after end " + end);
        }
        requireRepresentable(start, end);
        return new Bounds(start, end);
    }

    /**
     * Rejects bounds outside the range the store can index (about +-292,000 years around 1970).
     */
    static void requireRepresentable(Instant start, Instant end) {
        if (!MonotonicMicros.isRepresentable(start) || !MonotonicMicros.isRepresentable(end)) {
            throw new InvalidQueryException("Window [" + start + " .. " + end + "] is outside "
                + MonotonicMicros.MIN_INSTANT + " .. " + MonotonicMicros.MAX_INSTANT);
        }
    }

    private Bounds lastMinutes(int minutes, LocalDate date) {
        if (minutes <= 0) {
            throw new InvalidQueryException("Lookback minutes must be positive: " + minutes);
        }
        LocalDate today = SessionClock.today(clock);
        LocalDate day = date != null ? date : today;
        if (day.isAfter(today)) {
            throw new InvalidQueryException("Reference date " + day + " is in the future");
        }

        Instant reference = day.equals(today) ? clock.instant() : SessionClock.getSessionEnd(day);
        return new Bounds(reference.minus(Duration.ofMinutes(minutes)), reference);
    }

    private Bounds wholeDay(LocalDate date) {
        LocalDate today = SessionClock.today(clock);
        LocalDate day = date != null ? date : today;
        if (day.isAfter(today)) {
            throw new InvalidQueryException("Date " + day + " is in the future");
        }

        Instant start = SessionClock.getDayStart(day);
        Instant end = day.equals(today)
            ? clock.instant()
            : SessionClock.getDayStart(day.plusDays(1)).minus(1, ChronoUnit.MICROS);
        return new Bounds(start, end);
    }
}
