package in.optiontick.service.query;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * NSE calendar helpers in IST.
 *
 * The regular session closes at 15:30 IST.
 */
public final class SessionClock {
    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private static final LocalTime SESSION_END = LocalTime.of(15, 30);

    /**
     * Session end for a given date (15:30 IST).
     */
    public static Instant getSessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_END, IST).toInstant();
    }

    /**
     * Midnight IST at the start of a date.
     */
    public static Instant getDayStart(LocalDate date) {
        return date.atStartOfDay(IST).toInstant();
    }

    /**
     * The IST calendar date of an instant.
     */
    public static LocalDate dateOf(Instant instant) {
        return instant.atZone(IST).toLocalDate();
    }

    public static LocalDate today(Clock clock) {
        return dateOf(clock.instant());
    }

    private SessionClock() {}
}
