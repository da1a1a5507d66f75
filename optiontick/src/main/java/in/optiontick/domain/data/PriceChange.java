package in.optiontick.domain.data;

/**
 * Derived price metrics computed at read time.
 */
public final class PriceChange {

    /**
     * (last - prevClose) / prevClose * 100, or 0 when the previous close is zero
     * or not a number.
     */
    public static double percent(double last, double prevClose) {
        if (prevClose == 0.0 || Double.isNaN(prevClose) || Double.isInfinite(prevClose)) {
            return 0.0;
        }
        return (last - prevClose) / prevClose * 100.0;
    }

    private PriceChange() {}
}
