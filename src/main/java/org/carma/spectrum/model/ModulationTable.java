package org.carma.spectrum.model;

import java.util.*;

/**
 * Fixed table of modulation formats together with the slot grid they are sized on.
 *
 * Provides the two pure sizing functions used by every allocator:
 * <pre>
 *   select(distance)            most efficient format whose reach covers the distance
 *   requiredSlots(bw, format)   floor(bw / (efficiency × slotWidth)) + guardBand, at least 1
 * </pre>
 *
 * The table never changes after construction.
 */
public final class ModulationTable {

    /** Default grid: 12.5 GHz slots with one guard-band slot. */
    public static final double DEFAULT_SLOT_WIDTH_GHZ = 12.5;
    public static final int DEFAULT_GUARD_BAND_SLOTS = 1;

    /** BPSK, QPSK, 8-QAM and 16-QAM with their standard transparent reach. */
    public static final List<ModulationFormat> DEFAULT_FORMATS = List.of(
        new ModulationFormat("BPSK", 4000, 1),
        new ModulationFormat("QPSK", 2000, 2),
        new ModulationFormat("8-QAM", 1000, 3),
        new ModulationFormat("16-QAM", 500, 4)
    );

    public static final ModulationTable DEFAULT =
        new ModulationTable(DEFAULT_FORMATS, DEFAULT_SLOT_WIDTH_GHZ, DEFAULT_GUARD_BAND_SLOTS);

    private final List<ModulationFormat> formats;
    private final Map<String, ModulationFormat> byName;
    private final List<ModulationFormat> byEfficiency;
    private final ModulationFormat longestReach;
    private final double slotWidthGhz;
    private final int guardBandSlots;

    public ModulationTable(List<ModulationFormat> formats, double slotWidthGhz, int guardBandSlots) {
        if (formats == null || formats.isEmpty()) {
            throw new IllegalArgumentException("Modulation table must contain at least one format");
        }
        if (slotWidthGhz <= 0) {
            throw new IllegalArgumentException("Slot width must be positive: " + slotWidthGhz);
        }
        if (guardBandSlots < 0) {
            throw new IllegalArgumentException("Guard band cannot be negative: " + guardBandSlots);
        }

        this.formats = List.copyOf(formats);
        this.byName = new LinkedHashMap<>();
        for (ModulationFormat format : this.formats) {
            if (byName.put(format.getName(), format) != null) {
                throw new IllegalArgumentException("Duplicate modulation format: " + format.getName());
            }
        }

        // Stable sort keeps table order among formats of equal efficiency
        List<ModulationFormat> sorted = new ArrayList<>(this.formats);
        sorted.sort(Comparator.comparingDouble(ModulationFormat::getSpectralEfficiency).reversed());
        this.byEfficiency = Collections.unmodifiableList(sorted);

        ModulationFormat longest = this.formats.get(0);
        for (ModulationFormat format : this.formats) {
            if (format.getMaxReachKm() > longest.getMaxReachKm()) {
                longest = format;
            }
        }
        this.longestReach = longest;
        this.slotWidthGhz = slotWidthGhz;
        this.guardBandSlots = guardBandSlots;
    }

    // ========================================================================
    // Selection
    // ========================================================================

    /**
     * Choose the highest-efficiency format whose reach covers the distance.
     * Distances beyond every reach fall back to the longest-reach format, so any
     * finite path gets an assignable modulation.
     */
    public ModulationFormat select(double distanceKm) {
        for (ModulationFormat format : byEfficiency) {
            if (format.reaches(distanceKm)) {
                return format;
            }
        }
        return longestReach;
    }

    /**
     * Look up a format by name.
     */
    public Optional<ModulationFormat> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    // ========================================================================
    // Slot Sizing
    // ========================================================================

    /**
     * Slots needed to carry the bandwidth with the named format.
     * @throws IllegalArgumentException if the name is not in this table
     */
    public int requiredSlots(double bandwidthGbps, String modulationName) {
        ModulationFormat format = byName.get(modulationName);
        if (format == null) {
            throw new IllegalArgumentException(
                "Unknown modulation format: " + modulationName + " (known: " + byName.keySet() + ")");
        }
        return requiredSlots(bandwidthGbps, format);
    }

    /**
     * Slots needed to carry the bandwidth with the given format, guard band included.
     */
    public int requiredSlots(double bandwidthGbps, ModulationFormat format) {
        double dataSlots = bandwidthGbps / (format.getSpectralEfficiency() * slotWidthGhz);
        int total = (int) Math.floor(dataSlots) + guardBandSlots;
        return Math.max(1, total);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public List<ModulationFormat> getFormats() {
        return formats;
    }

    public ModulationFormat getLongestReach() {
        return longestReach;
    }

    public double getSlotWidthGhz() {
        return slotWidthGhz;
    }

    public int getGuardBandSlots() {
        return guardBandSlots;
    }

    @Override
    public String toString() {
        return String.format("ModulationTable[%s, slot=%.1f GHz, guard=%d]",
            formats, slotWidthGhz, guardBandSlots);
    }
}
