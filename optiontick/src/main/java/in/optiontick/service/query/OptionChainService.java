package in.optiontick.service.query;

import in.optiontick.domain.data.InstrumentRegistry;
import in.optiontick.domain.data.InstrumentRegistry.StrikePair;
import in.optiontick.domain.data.SnapshotRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Option chain view: per strike, the latest call and put rows side by side.
 */
public final class OptionChainService {

    /**
     * One strike of the chain; a side is null when it has no key or no data.
     */
    public record ChainRow(String strike, String callKey, SnapshotRow call, String putKey, SnapshotRow put) {
    }

    private final SnapshotQueryService snapshotService;

    public OptionChainService(SnapshotQueryService snapshotService) {
        this.snapshotService = snapshotService;
    }

    /**
     * Chain rows in strike order, as of {@code asOf}.
     */
    public List<ChainRow> chain(InstrumentRegistry registry, Instant asOf) {
        Map<String, SnapshotRow> latest = snapshotService.latest(registry.subscriptionSet(), asOf);

        List<ChainRow> rows = new ArrayList<>(registry.size());
        for (Map.Entry<String, StrikePair> entry : registry.strikes().entrySet()) {
            StrikePair pair = entry.getValue();
            rows.add(new ChainRow(
                entry.getKey(),
                pair.call(),
                pair.call() != null ? latest.get(pair.call()) : null,
                pair.put(),
                pair.put() != null ? latest.get(pair.put()) : null
            ));
        }
        return rows;
    }
}
