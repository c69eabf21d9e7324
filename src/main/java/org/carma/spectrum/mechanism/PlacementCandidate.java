package org.carma.spectrum.mechanism;

import org.carma.spectrum.model.*;
import org.carma.spectrum.network.NetworkPath;

import java.util.Comparator;

/**
 * A (path, offset) pair evaluated against the ledger but not yet committed,
 * with the watermark figures committing it would produce.
 *
 * Two lexicographic orders rank candidates:
 * <pre>
 *   WATERMARK_ORDER  (increase, resulting watermark, path length, offset)
 *   SHORT_PATH_ORDER (path length, offset, increase, resulting watermark)
 * </pre>
 */
public final class PlacementCandidate {

    /** Normal load: keep the watermark low, then prefer short paths. */
    public static final Comparator<PlacementCandidate> WATERMARK_ORDER =
        Comparator.comparingInt(PlacementCandidate::getWatermarkIncrease)
            .thenComparingInt(PlacementCandidate::getResultingWatermark)
            .thenComparingInt(PlacementCandidate::getPathLength)
            .thenComparingInt(PlacementCandidate::getStartSlot);

    /** High load: prefer short paths and low offsets over tight packing. */
    public static final Comparator<PlacementCandidate> SHORT_PATH_ORDER =
        Comparator.comparingInt(PlacementCandidate::getPathLength)
            .thenComparingInt(PlacementCandidate::getStartSlot)
            .thenComparingInt(PlacementCandidate::getWatermarkIncrease)
            .thenComparingInt(PlacementCandidate::getResultingWatermark);

    private final NetworkPath path;
    private final int[] links;
    private final int startSlot;
    private final int slotCount;
    private final ModulationFormat modulation;
    private final int resultingWatermark;
    private final double averageWatermark;
    private final int watermarkIncrease;

    private PlacementCandidate(NetworkPath path, int[] links, int startSlot, int slotCount,
                               ModulationFormat modulation, int resultingWatermark,
                               double averageWatermark, int watermarkIncrease) {
        this.path = path;
        this.links = links;
        this.startSlot = startSlot;
        this.slotCount = slotCount;
        this.modulation = modulation;
        this.resultingWatermark = resultingWatermark;
        this.averageWatermark = averageWatermark;
        this.watermarkIncrease = watermarkIncrease;
    }

    /**
     * Simulate placing {@code [start, start + slots)} on the links without
     * touching the ledger.
     *
     * Resulting watermark is the highest per-link watermark over the path after
     * placement; the increase is how far the window end rises above the
     * current global watermark.
     */
    public static PlacementCandidate evaluate(SpectrumLedger ledger, NetworkPath path, int[] links,
                                              int start, int slots, ModulationFormat modulation) {
        int end = start + slots;
        int resulting = 0;
        long sum = 0;
        for (int link : links) {
            int after = Math.max(ledger.linkWatermark(link), end);
            resulting = Math.max(resulting, after);
            sum += after;
        }
        double average = (double) sum / links.length;
        int increase = Math.max(0, end - ledger.getWatermark());
        return new PlacementCandidate(path, links, start, slots, modulation, resulting, average, increase);
    }

    public Circuit toCircuit(Demand demand) {
        return new Circuit(demand, path, links, startSlot, slotCount, modulation);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public NetworkPath getPath() { return path; }
    public int[] getLinks() { return links.clone(); }
    public int getStartSlot() { return startSlot; }
    public int getSlotCount() { return slotCount; }
    public ModulationFormat getModulation() { return modulation; }
    public int getResultingWatermark() { return resultingWatermark; }
    public double getAverageWatermark() { return averageWatermark; }
    public int getWatermarkIncrease() { return watermarkIncrease; }

    /**
     * Hop count of the candidate path.
     */
    public int getPathLength() {
        return path.getHopCount();
    }

    int[] linksForCommit() {
        return links;
    }

    @Override
    public String toString() {
        return String.format("Candidate[%s @%d+%d, increase=%d, resulting=%d, avg=%.1f]",
            path, startSlot, slotCount, watermarkIncrease, resultingWatermark, averageWatermark);
    }
}
