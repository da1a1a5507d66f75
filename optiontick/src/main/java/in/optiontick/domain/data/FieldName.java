package in.optiontick.domain.data;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Queryable fields of an {@link Observation}.
 *
 * Every stored field maps to one column of the tick table; {@link #CHANGE_PERCENT}
 * is derived from last price and previous close.
 */
public enum FieldName {
    LAST_PRICE("ltp", Observation::lastPrice),
    PREV_CLOSE("cp", Observation::prevClose),
    OPEN_INTEREST("oi", Observation::openInterest),
    IMPLIED_VOL("iv", Observation::impliedVol),
    DELTA("delta", Observation::delta),
    GAMMA("gamma", Observation::gamma),
    VEGA("vega", Observation::vega),
    THETA("theta", Observation::theta),
    CHANGE_PERCENT(null, Observation::changePercent);

    // Feed paths as they appear in the Upstox payload.
    private static final Map<String, FieldName> ALIASES = Map.ofEntries(
        Map.entry("ltpc.ltp", LAST_PRICE),
        Map.entry("last_price", LAST_PRICE),
        Map.entry("ltpc.cp", PREV_CLOSE),
        Map.entry("close_price", PREV_CLOSE),
        Map.entry("open_interest", OPEN_INTEREST),
        Map.entry("implied_vol", IMPLIED_VOL),
        Map.entry("optiongreeks.delta", DELTA),
        Map.entry("optiongreeks.gamma", GAMMA),
        Map.entry("optiongreeks.vega", VEGA),
        Map.entry("optiongreeks.theta", THETA),
        Map.entry("change", CHANGE_PERCENT),
        Map.entry("change_pct", CHANGE_PERCENT),
        Map.entry("change_percent", CHANGE_PERCENT)
    );

    private final String column;
    private final ToDoubleFunction<Observation> extractor;

    FieldName(String column, ToDoubleFunction<Observation> extractor) {
        this.column = column;
        this.extractor = extractor;
    }

    /**
     * Column in the tick table, or null for derived fields.
     */
    public String column() {
        return column;
    }

    public boolean isDerived() {
        return column == null;
    }

    public double valueOf(Observation observation) {
        return extractor.applyAsDouble(observation);
    }

    /**
     * Case-insensitive lookup by enum name, column name or feed path.
     */
    public static Optional<FieldName> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FieldName field : values()) {
            if (field.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || normalized.equals(field.column)) {
                return Optional.of(field);
            }
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }
}
