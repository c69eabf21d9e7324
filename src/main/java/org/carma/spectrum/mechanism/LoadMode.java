package org.carma.spectrum.mechanism;

import org.carma.spectrum.config.SpectrumConfig;

/**
 * Search regime of the adaptive allocator, chosen from live load signals
 * before every demand.
 *
 * | Mode | Trigger | Paths | Offsets | Objective |
 * |------|---------|-------|---------|-----------|
 * | EXTREME | ratio &gt; 0.92 or util &gt; 0.18 | 3 | 1 | first feasible |
 * | HIGH | ratio &gt; 0.70 or util &gt; 0.10 | 5 | 3 | short path, low offset |
 * | NORMAL | otherwise | k | 10 | minimum watermark |
 */
public enum LoadMode {
    NORMAL,
    HIGH,
    EXTREME;

    /** Extreme load degrades to a single first-fit offset per path. */
    public static final int EXTREME_OFFSET_LIMIT = 1;

    /**
     * Pick the mode for the given signals. Extreme is checked before high.
     *
     * @param watermarkRatio global watermark / slot capacity
     * @param utilization fraction of occupied cells
     */
    public static LoadMode select(double watermarkRatio, double utilization, SpectrumConfig config) {
        if (watermarkRatio > config.getExtremeWatermarkRatio() || utilization > config.getExtremeUtilization()) {
            return EXTREME;
        }
        if (watermarkRatio > config.getHighWatermarkRatio() || utilization > config.getHighUtilization()) {
            return HIGH;
        }
        return NORMAL;
    }

    public int pathCount(SpectrumConfig config) {
        switch (this) {
            case EXTREME: return config.getExtremeLoadPathCount();
            case HIGH: return config.getHighLoadPathCount();
            default: return config.getDefaultPathCount();
        }
    }

    public int offsetLimit(SpectrumConfig config) {
        switch (this) {
            case EXTREME: return EXTREME_OFFSET_LIMIT;
            case HIGH: return config.getHighOffsetLimit();
            default: return config.getNormalOffsetLimit();
        }
    }
}
