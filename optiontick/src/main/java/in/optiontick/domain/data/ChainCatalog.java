package in.optiontick.domain.data;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Named option chains, one per chain file (e.g. {@code nifty_50-16-01-2025}).
 *
 * Chains are ordered by name and the first one is the default view. The
 * subscription set is the union of every chain's instrument keys.
 */
public final class ChainCatalog {

    private static final String JSON_SUFFIX = ".json";

    private final Map<String, InstrumentRegistry> chains;
    private final Set<String> subscriptionSet;

    public ChainCatalog(Map<String, InstrumentRegistry> chains) {
        Map<String, InstrumentRegistry> sorted = new TreeMap<>();
        for (Map.Entry<String, InstrumentRegistry> e : chains.entrySet()) {
            sorted.put(chainName(e.getKey()), e.getValue());
        }
        Set<String> keys = new LinkedHashSet<>();
        for (InstrumentRegistry registry : sorted.values()) {
            keys.addAll(registry.subscriptionSet());
        }
        this.chains = Collections.unmodifiableMap(sorted);
        this.subscriptionSet = Collections.unmodifiableSet(keys);
    }

    public static ChainCatalog empty() {
        return new ChainCatalog(Map.of());
    }

    public static ChainCatalog of(String name, InstrumentRegistry registry) {
        return new ChainCatalog(Map.of(name, registry));
    }

    /**
     * Chain name for a file name or a bare name: {@code nifty_50-16-01-2025.json} becomes {@code nifty_50-16-01-2025}.
     */
    public static String chainName(String fileOrName) {
        String name = fileOrName.trim();
        return name.endsWith(JSON_SUFFIX) ? name.substring(0, name.length() - JSON_SUFFIX.length()) : name;
    }

    /**
     * Chains by name, in name order.
     */
    public Map<String, InstrumentRegistry> chains() {
        return chains;
    }

    public Optional<InstrumentRegistry> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chains.get(chainName(name)));
    }

    public Optional<String> defaultChain() {
        return chains.keySet().stream().findFirst();
    }

    /**
     * Union of instrument keys across all chains, each key once.
     */
    public Set<String> subscriptionSet() {
        return subscriptionSet;
    }

    public int size() {
        return chains.size();
    }

    public boolean isEmpty() {
        return chains.isEmpty();
    }
}
