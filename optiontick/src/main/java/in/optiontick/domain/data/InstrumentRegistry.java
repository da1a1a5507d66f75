package in.optiontick.domain.data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Option chain for one underlying and expiry: strike to call/put instrument keys.
 *
 * Strikes are kept as the strings found in the source file and ordered
 * numerically where they parse, lexically otherwise.
 */
public final class InstrumentRegistry {

    public enum OptionSide {
        CE, PE
    }

    /**
     * Call and put keys at one strike; either may be null.
     */
    public record StrikePair(String call, String put) {
        public String key(OptionSide side) {
            return side == OptionSide.CE ? call : put;
        }
    }

    /**
     * Where an instrument key sits in the chain.
     */
    public record Position(String strike, OptionSide side) {
    }

    private static final Comparator<String> STRIKE_ORDER = (a, b) -> {
        BigDecimal x = parseStrike(a);
        BigDecimal y = parseStrike(b);
        if (x != null && y != null) {
            int cmp = x.compareTo(y);
            return cmp != 0 ? cmp : a.compareTo(b);
        }
        if (x != null) return -1;
        if (y != null) return 1;
        return a.compareTo(b);
    };

    private final Map<String, StrikePair> strikes;
    private final Map<String, Position> positions;

    public InstrumentRegistry(Map<String, StrikePair> strikes) {
        List<String> ordered = new ArrayList<>(strikes.keySet());
        ordered.sort(STRIKE_ORDER);

        Map<String, StrikePair> sorted = new LinkedHashMap<>();
        Map<String, Position> index = new HashMap<>();
        for (String strike : ordered) {
            StrikePair pair = strikes.get(strike);
            sorted.put(strike, pair);
            if (pair.call() != null) index.put(pair.call(), new Position(strike, OptionSide.CE));
            if (pair.put() != null) index.put(pair.put(), new Position(strike, OptionSide.PE));
        }
        this.strikes = Collections.unmodifiableMap(sorted);
        this.positions = Collections.unmodifiableMap(index);
    }

    public static InstrumentRegistry empty() {
        return new InstrumentRegistry(Map.of());
    }

    /**
     * Strikes in chain order.
     */
    public Map<String, StrikePair> strikes() {
        return strikes;
    }

    /**
     * Distinct instrument keys across all strikes, in chain order (calls before puts per strike).
     */
    public Set<String> subscriptionSet() {
        Set<String> keys = new LinkedHashSet<>();
        for (StrikePair pair : strikes.values()) {
            if (pair.call() != null) keys.add(pair.call());
            if (pair.put() != null) keys.add(pair.put());
        }
        return Collections.unmodifiableSet(keys);
    }

    public Optional<Position> resolve(String instrumentKey) {
        return Optional.ofNullable(positions.get(instrumentKey));
    }

    public int size() {
        return strikes.size();
    }

    public boolean isEmpty() {
        return strikes.isEmpty();
    }

    private static BigDecimal parseStrike(String strike) {
        try {
            return new BigDecimal(strike.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
