package org.carma.spectrum.config;

import org.carma.spectrum.model.*;

import java.util.*;

/**
 * Immutable spectrum and allocation settings, built once and passed into the
 * ledger, allocators and scheduler.
 *
 * <h2>Settings</h2>
 *
 * | Setting | Default |
 * |---------|---------|
 * | Slots per link | 320 |
 * | Slot width | 12.5 GHz |
 * | Guard band | 1 slot |
 * | Modulation table | BPSK/QPSK/8-QAM/16-QAM |
 * | Candidate paths (normal / high / extreme) | 3 / 5 / 3 |
 * | Offsets searched (normal / high / extreme) | 10 / 3 / 1 |
 * | High load | watermark ratio &gt; 0.70 or utilization &gt; 0.10 |
 * | Extreme load | watermark ratio &gt; 0.92 or utilization &gt; 0.18 |
 *
 * @see org.carma.spectrum.mechanism.LoadMode
 */
public final class SpectrumConfig {

    // ========================================================================
    // Constants
    // ========================================================================

    public static final int DEFAULT_SLOT_CAPACITY = 320;
    public static final int DEFAULT_PATH_COUNT = 3;

    /** Default settings for NSFNET-scale experiments. */
    public static final SpectrumConfig DEFAULT = new SpectrumConfig.Builder().build();

    // ========================================================================
    // Fields
    // ========================================================================

    private final int slotCapacity;
    private final ModulationTable modulationTable;

    private final int defaultPathCount;
    private final int highLoadPathCount;
    private final int extremeLoadPathCount;

    private final double highWatermarkRatio;
    private final double highUtilization;
    private final double extremeWatermarkRatio;
    private final double extremeUtilization;

    private final int normalOffsetLimit;
    private final int highOffsetLimit;

    private SpectrumConfig(Builder builder, ModulationTable table) {
        this.slotCapacity = builder.slotCapacity;
        this.modulationTable = table;
        this.defaultPathCount = builder.defaultPathCount;
        this.highLoadPathCount = builder.highLoadPathCount;
        this.extremeLoadPathCount = builder.extremeLoadPathCount;
        this.highWatermarkRatio = builder.highWatermarkRatio;
        this.highUtilization = builder.highUtilization;
        this.extremeWatermarkRatio = builder.extremeWatermarkRatio;
        this.extremeUtilization = builder.extremeUtilization;
        this.normalOffsetLimit = builder.normalOffsetLimit;
        this.highOffsetLimit = builder.highOffsetLimit;
    }

    // ========================================================================
    // Getters
    // ========================================================================

    public int getSlotCapacity() { return slotCapacity; }
    public ModulationTable getModulationTable() { return modulationTable; }
    public double getSlotWidthGhz() { return modulationTable.getSlotWidthGhz(); }
    public int getGuardBandSlots() { return modulationTable.getGuardBandSlots(); }

    /**
     * Candidate paths searched per demand under normal load.
     */
    public int getDefaultPathCount() { return defaultPathCount; }
    public int getHighLoadPathCount() { return highLoadPathCount; }
    public int getExtremeLoadPathCount() { return extremeLoadPathCount; }

    public double getHighWatermarkRatio() { return highWatermarkRatio; }
    public double getHighUtilization() { return highUtilization; }
    public double getExtremeWatermarkRatio() { return extremeWatermarkRatio; }
    public double getExtremeUtilization() { return extremeUtilization; }

    public int getNormalOffsetLimit() { return normalOffsetLimit; }
    public int getHighOffsetLimit() { return highOffsetLimit; }

    public Builder toBuilder() {
        return new Builder()
            .slotCapacity(slotCapacity)
            .slotWidthGhz(modulationTable.getSlotWidthGhz())
            .guardBandSlots(modulationTable.getGuardBandSlots())
            .modulationFormats(modulationTable.getFormats())
            .defaultPathCount(defaultPathCount)
            .highLoadPathCount(highLoadPathCount)
            .extremeLoadPathCount(extremeLoadPathCount)
            .highLoadThresholds(highWatermarkRatio, highUtilization)
            .extremeLoadThresholds(extremeWatermarkRatio, extremeUtilization)
            .offsetLimits(normalOffsetLimit, highOffsetLimit);
    }

    @Override
    public String toString() {
        return String.format(
            "SpectrumConfig[slots=%d, width=%.1fGHz, guard=%d, k=%d/%d/%d, offsets=%d/%d/1, " +
            "high=(%.2f, %.2f), extreme=(%.2f, %.2f)]",
            slotCapacity, getSlotWidthGhz(), getGuardBandSlots(),
            defaultPathCount, highLoadPathCount, extremeLoadPathCount,
            normalOffsetLimit, highOffsetLimit,
            highWatermarkRatio, highUtilization, extremeWatermarkRatio, extremeUtilization);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private int slotCapacity = DEFAULT_SLOT_CAPACITY;
        private double slotWidthGhz = ModulationTable.DEFAULT_SLOT_WIDTH_GHZ;
        private int guardBandSlots = ModulationTable.DEFAULT_GUARD_BAND_SLOTS;
        private List<ModulationFormat> modulationFormats = ModulationTable.DEFAULT_FORMATS;

        private int defaultPathCount = DEFAULT_PATH_COUNT;
        private int highLoadPathCount = 5;
        private int extremeLoadPathCount = 3;

        private double highWatermarkRatio = 0.70;
        private double highUtilization = 0.10;
        private double extremeWatermarkRatio = 0.92;
        private double extremeUtilization = 0.18;

        private int normalOffsetLimit = 10;
        private int highOffsetLimit = 3;

        public Builder slotCapacity(int slots) {
            this.slotCapacity = slots;
            return this;
        }

        public Builder slotWidthGhz(double ghz) {
            this.slotWidthGhz = ghz;
            return this;
        }

        public Builder guardBandSlots(int slots) {
            this.guardBandSlots = slots;
            return this;
        }

        public Builder modulationFormats(List<ModulationFormat> formats) {
            this.modulationFormats = formats != null ? new ArrayList<>(formats) : null;
            return this;
        }

        public Builder defaultPathCount(int k) {
            this.defaultPathCount = k;
            return this;
        }

        public Builder highLoadPathCount(int k) {
            this.highLoadPathCount = k;
            return this;
        }

        public Builder extremeLoadPathCount(int k) {
            this.extremeLoadPathCount = k;
            return this;
        }

        public Builder highLoadThresholds(double watermarkRatio, double utilization) {
            this.highWatermarkRatio = watermarkRatio;
            this.highUtilization = utilization;
            return this;
        }

        public Builder extremeLoadThresholds(double watermarkRatio, double utilization) {
            this.extremeWatermarkRatio = watermarkRatio;
            this.extremeUtilization = utilization;
            return this;
        }

        /**
         * Best-fit offsets searched per path under normal and high load.
         * Extreme load always searches a single first-fit offset.
         */
        public Builder offsetLimits(int normal, int high) {
            this.normalOffsetLimit = normal;
            this.highOffsetLimit = high;
            return this;
        }

        /**
         * Validate and build.
         * @throws ConfigValidationException listing every invalid setting
         */
        public SpectrumConfig build() {
            List<String> errors = new ArrayList<>();

            if (slotCapacity <= 0) {
                errors.add("slotCapacity must be positive, got " + slotCapacity);
            }
            requireAtLeastOne(errors, "defaultPathCount", defaultPathCount);
            requireAtLeastOne(errors, "highLoadPathCount", highLoadPathCount);
            requireAtLeastOne(errors, "extremeLoadPathCount", extremeLoadPathCount);
            requireAtLeastOne(errors, "normalOffsetLimit", normalOffsetLimit);
            requireAtLeastOne(errors, "highOffsetLimit", highOffsetLimit);

            requireFraction(errors, "highWatermarkRatio", highWatermarkRatio);
            requireFraction(errors, "highUtilization", highUtilization);
            requireFraction(errors, "extremeWatermarkRatio", extremeWatermarkRatio);
            requireFraction(errors, "extremeUtilization", extremeUtilization);
            if (extremeWatermarkRatio < highWatermarkRatio) {
                errors.add("extremeWatermarkRatio (" + extremeWatermarkRatio +
                    ") must not be below highWatermarkRatio (" + highWatermarkRatio + ")");
            }
            if (extremeUtilization < highUtilization) {
                errors.add("extremeUtilization (" + extremeUtilization +
                    ") must not be below highUtilization (" + highUtilization + ")");
            }

            ModulationTable table = null;
            try {
                table = new ModulationTable(modulationFormats, slotWidthGhz, guardBandSlots);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }

            if (!errors.isEmpty()) {
                throw new ConfigValidationException("spectrum", errors);
            }
            return new SpectrumConfig(this, table);
        }

        private static void requireAtLeastOne(List<String> errors, String field, int value) {
            if (value < 1) {
                errors.add(field + " must be at least 1, got " + value);
            }
        }

        private static void requireFraction(List<String> errors, String field, double value) {
            if (!(value >= 0.0 && value <= 1.0)) {
                errors.add(field + " must lie in [0, 1], got " + value);
            }
        }
    }
}
