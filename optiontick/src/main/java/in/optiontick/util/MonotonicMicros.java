package in.optiontick.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Strictly increasing microsecond timestamps.
 *
 * Wall-clock readings are truncated to micros. A reading that does not move past
 * the previous stamp (same microsecond, or the clock stepped back) is bumped to
 * previous + 1us.
 */
public final class MonotonicMicros {

    /** Earliest instant whose micro value fits in a long. */
    public static final Instant MIN_INSTANT = Instant.ofEpochSecond(Long.MIN_VALUE / 1_000_000L + 1);
    /** Latest instant whose micro value fits in a long. */
    public static final Instant MAX_INSTANT = Instant.ofEpochSecond(Long.MAX_VALUE / 1_000_000L - 1);

    private final Clock clock;
    private long lastMicros = Long.MIN_VALUE;

    public MonotonicMicros(Clock clock) {
        this.clock = clock;
    }

    public synchronized Instant next() {
        long now = toMicros(clock.instant());
        if (now <= lastMicros) {
            now = lastMicros + 1;
        }
        lastMicros = now;
        return fromMicros(now);
    }

    public static boolean isRepresentable(Instant instant) {
        return !instant.isBefore(MIN_INSTANT) && !instant.isAfter(MAX_INSTANT);
    }

    public static long toMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
            instant.getNano() / 1_000);
    }

    /**
     * Smallest micro value not before {@code instant}.
     */
    public static long toMicrosCeil(Instant instant) {
        long micros = toMicros(instant);
        return instant.getNano() % 1_000 == 0 ? micros : micros + 1;
    }

    public static Instant fromMicros(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }
}
