package in.optiontick.domain.data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Time window for a range query, before resolution against a clock.
 *
 * <ul>
 *   <li>{@link Kind#BETWEEN}: explicit inclusive bounds</li>
 *   <li>{@link Kind#LAST_MINUTES}: the n minutes up to a reference instant on a date</li>
 *   <li>{@link Kind#WHOLE_DAY}: the whole of a date</li>
 * </ul>
 */
public final class TimeWindow {

    public enum Kind { BETWEEN, LAST_MINUTES, WHOLE_DAY }

    private final Kind kind;
    private final Instant start;
    private final Instant end;
    private final int minutes;
    private final LocalDate date;

    private TimeWindow(Kind kind, Instant start, Instant end, int minutes, LocalDate date) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.minutes = minutes;
        this.date = date;
    }

    public static TimeWindow between(Instant start, Instant end) {
        return new TimeWindow(Kind.BETWEEN, start, end, 0, null);
    }

    public static TimeWindow lastMinutes(int minutes, LocalDate referenceDate) {
        return new TimeWindow(Kind.LAST_MINUTES, null, null, minutes, referenceDate);
    }

    public static TimeWindow wholeDay(LocalDate date) {
        return new TimeWindow(Kind.WHOLE_DAY, null, null, 0, date);
    }

    public Kind kind() {
        return kind;
    }

    public Instant start() {
        return start;
    }

    public Instant end() {
        return end;
    }

    public int minutes() {
        return minutes;
    }

    public LocalDate date() {
        return date;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeWindow)) return false;
        TimeWindow that = (TimeWindow) o;
        return kind == that.kind && minutes == that.minutes
            && Objects.equals(start, that.start)
            && Objects.equals(end, that.end)
            && Objects.equals(date, that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, start, end, minutes, date);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BETWEEN -> "between(" + start + ", " + end + ")";
            case LAST_MINUTES -> "last " + minutes + "m on " + date;
            case WHOLE_DAY -> "whole day " + date;
        };
    }
}
