package org.carma.spectrum.model;

import org.carma.spectrum.network.*;

import java.util.*;

/**
 * Per-link frequency-slot occupancy for one allocation run.
 *
 * The ledger tracks:
 * - One occupancy bit set of {@code capacity} slots per link
 * - The global watermark: 1 + highest occupied slot on any link, 0 when empty
 * - The link index of every graph edge, fixed at construction
 *
 * Every placement respects spectrum continuity: a reservation holds the same
 * slot range on all links of its path. Commits re-check every targeted cell
 * and leave the ledger untouched when any of them is taken.
 *
 * A ledger belongs to a single scheduler run and is not thread-safe.
 */
public class SpectrumLedger {

    private final int capacity;
    private final BitSet[] occupancy;
    private final NetworkGraph graph;
    private int watermark;

    /**
     * Create a ledger with one row per graph link, indexed in link order.
     */
    public SpectrumLedger(NetworkGraph graph, int capacity) {
        this(graph, graph.getLinkCount(), capacity);
    }

    /**
     * Create a ledger of anonymous links. Paths cannot be resolved against it.
     */
    public SpectrumLedger(int linkCount, int capacity) {
        this(null, linkCount, capacity);
    }

    private SpectrumLedger(NetworkGraph graph, int linkCount, int capacity) {
        if (linkCount < 0) {
            throw new IllegalArgumentException("Link count cannot be negative: " + linkCount);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Slot capacity must be positive: " + capacity);
        }
        this.graph = graph;
        this.capacity = capacity;
        this.occupancy = new BitSet[linkCount];
        for (int i = 0; i < linkCount; i++) {
            occupancy[i] = new BitSet(capacity);
        }
        this.watermark = 0;
    }

    // ========================================================================
    // Link Resolution
    // ========================================================================

    /**
     * Link indices along a path in traversal order. Empty if the ledger has no
     * graph or a hop is not a link of it.
     */
    public Optional<int[]> resolveLinks(NetworkPath path) {
        if (graph == null) {
            return Optional.empty();
        }
        List<String> nodes = path.getNodes();
        int[] links = new int[nodes.size() - 1];
        for (int i = 0; i < links.length; i++) {
            int index = graph.linkIndex(nodes.get(i), nodes.get(i + 1));
            if (index < 0 || index >= occupancy.length) {
                return Optional.empty();
            }
            links[i] = index;
        }
        return Optional.of(links);
    }

    // ========================================================================
    // Placement Queries
    // ========================================================================

    /**
     * Lowest start slot whose window {@code [start, start + slots)} is free on
     * every given link, or empty if no such window fits in capacity.
     */
    public OptionalInt findFirstFit(int[] links, int slots) {
        if (!isValidRequest(links, slots)) {
            return OptionalInt.empty();
        }
        BitSet used = union(links);
        int start = 0;
        while (start + slots <= capacity) {
            int blocker = used.nextSetBit(start);
            if (blocker < 0 || blocker >= start + slots) {
                return OptionalInt.of(start);
            }
            start = used.nextClearBit(blocker);
        }
        return OptionalInt.empty();
    }

    /**
     * Ranked feasible start slots, at most {@code maxPositions} of them.
     *
     * Offsets that keep the highest link watermark of {@code links} unchanged
     * come first, lowest offset first. Remaining places go to offsets that raise
     * it, ordered by (increase, resulting watermark, offset).
     */
    public List<Integer> findBestFitPositions(int[] links, int slots, int maxPositions) {
        if (!isValidRequest(links, slots) || maxPositions <= 0) {
            return Collections.emptyList();
        }
        int currentMax = maxLinkWatermark(links);
        BitSet used = union(links);

        List<Integer> noIncrease = new ArrayList<>();
        List<int[]> raising = new ArrayList<>(); // {offset, increase, resulting}

        int start = 0;
        while (start + slots <= capacity) {
            int blocker = used.nextSetBit(start);
            if (blocker >= 0 && blocker < start + slots) {
                start = used.nextClearBit(blocker);
                continue;
            }
            int resulting = Math.max(currentMax, start + slots);
            int increase = resulting - currentMax;
            if (increase == 0) {
                noIncrease.add(start);
            } else {
                raising.add(new int[] {start, increase, resulting});
            }
            start++;
        }

        List<Integer> ranked = new ArrayList<>(Math.min(maxPositions, noIncrease.size() + raising.size()));
        for (int offset : noIncrease) {
            if (ranked.size() == maxPositions) return ranked;
            ranked.add(offset);
        }

        raising.sort(Comparator.<int[]>comparingInt(c -> c[1])
            .thenComparingInt(c -> c[2])
            .thenComparingInt(c -> c[0]));
        for (int[] candidate : raising) {
            if (ranked.size() == maxPositions) break;
            ranked.add(candidate[0]);
        }
        return ranked;
    }

    /**
     * Whether {@code [start, start + slots)} is free on every given link.
     */
    public boolean isWindowFree(int[] links, int start, int slots) {
        if (!isValidRequest(links, slots) || start < 0 || start + slots > capacity) {
            return false;
        }
        for (int link : links) {
            int blocker = occupancy[link].nextSetBit(start);
            if (blocker >= 0 && blocker < start + slots) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Reserve {@code [start, start + slots)} on every given link.
     *
     * @return false, with nothing changed, if the parameters are out of range or
     *         any targeted cell is already occupied
     */
    public boolean commit(int[] links, int start, int slots) {
        if (!isWindowFree(links, start, slots)) {
            return false;
        }
        for (int link : links) {
            occupancy[link].set(start, start + slots);
        }
        watermark = Math.max(watermark, start + slots);
        return true;
    }

    /**
     * Free {@code [start, start + slots)} on the given links and rescan the
     * watermark. Out-of-range links and slots are ignored.
     */
    public void release(int[] links, int start, int slots) {
        if (links == null || links.length == 0 || slots <= 0) {
            return;
        }
        int from = Math.max(0, start);
        int to = Math.min(capacity, start + slots);
        if (from >= to) {
            return;
        }
        for (int link : links) {
            if (link >= 0 && link < occupancy.length) {
                occupancy[link].clear(from, to);
            }
        }
        recalculateWatermark();
    }

    /**
     * Clear all occupancy.
     */
    public void reset() {
        for (BitSet bits : occupancy) {
            bits.clear();
        }
        watermark = 0;
    }

    private void recalculateWatermark() {
        int highest = 0;
        for (BitSet bits : occupancy) {
            highest = Math.max(highest, bits.length());
        }
        watermark = highest;
    }

    // ========================================================================
    // Load Metrics
    // ========================================================================

    public int getWatermark() {
        return watermark;
    }

    /**
     * Global watermark as a fraction of slot capacity.
     */
    public double getWatermarkRatio() {
        return (double) watermark / capacity;
    }

    /**
     * Highest occupied slot + 1 on one link, 0 if empty or out of range.
     */
    public int linkWatermark(int link) {
        if (link < 0 || link >= occupancy.length) {
            return 0;
        }
        return occupancy[link].length();
    }

    /**
     * Fraction of all (link, slot) cells occupied.
     */
    public double utilization() {
        long cells = (long) occupancy.length * capacity;
        if (cells == 0) return 0.0;
        return (double) occupiedSlotCount() / cells;
    }

    public double linkUtilization(int link) {
        if (link < 0 || link >= occupancy.length) {
            return 0.0;
        }
        return (double) occupancy[link].cardinality() / capacity;
    }

    public long occupiedSlotCount() {
        long total = 0;
        for (BitSet bits : occupancy) {
            total += bits.cardinality();
        }
        return total;
    }

    public boolean isOccupied(int link, int slot) {
        if (link < 0 || link >= occupancy.length || slot < 0 || slot >= capacity) {
            return false;
        }
        return occupancy[link].get(slot);
    }

    public int getLinkCount() {
        return occupancy.length;
    }

    public int getCapacity() {
        return capacity;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean isValidRequest(int[] links, int slots) {
        if (links == null || links.length == 0 || slots <= 0 || slots > capacity) {
            return false;
        }
        for (int link : links) {
            if (link < 0 || link >= occupancy.length) {
                return false;
            }
        }
        return true;
    }

    private BitSet union(int[] links) {
        BitSet used = new BitSet(capacity);
        for (int link : links) {
            used.or(occupancy[link]);
        }
        return used;
    }

    private int maxLinkWatermark(int[] links) {
        int max = 0;
        for (int link : links) {
            max = Math.max(max, occupancy[link].length());
        }
        return max;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SpectrumLedger[\n");
        sb.append(String.format("  links=%d, slots=%d, watermark=%d (%.1f%% utilized)\n",
            occupancy.length, capacity, watermark, utilization() * 100));
        for (int i = 0; i < occupancy.length; i++) {
            if (!occupancy[i].isEmpty()) {
                sb.append(String.format("  link %d: %s\n", i, occupancy[i]));
            }
        }
        sb.append("]");
        return sb.toString();
    }
}
