package in.optiontick.domain.data;

/**
 * Latest observation of one instrument within a query window, with the derived
 * change percent.
 */
public record SnapshotRow(Observation observation, double changePercent) {

    public static SnapshotRow of(Observation observation) {
        return new SnapshotRow(observation, observation.changePercent());
    }

    public String instrumentKey() {
        return observation.instrumentKey();
    }
}
