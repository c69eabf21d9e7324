package org.carma.spectrum.model;

import org.carma.spectrum.network.NetworkPath;

import java.util.Arrays;

/**
 * A committed placement: the demand, its path and the slot range it holds on
 * every link of that path. Holds exactly what a later release would need.
 */
public final class Circuit {

    private final Demand demand;
    private final NetworkPath path;
    private final int[] links;
    private final int startSlot;
    private final int slotCount;
    private final ModulationFormat modulation;

    public Circuit(Demand demand, NetworkPath path, int[] links,
                   int startSlot, int slotCount, ModulationFormat modulation) {
        this.demand = demand;
        this.path = path;
        this.links = links.clone();
        this.startSlot = startSlot;
        this.slotCount = slotCount;
        this.modulation = modulation;
    }

    public Demand getDemand() { return demand; }
    public NetworkPath getPath() { return path; }
    public int[] getLinks() { return links.clone(); }
    public int getStartSlot() { return startSlot; }
    public int getSlotCount() { return slotCount; }
    public ModulationFormat getModulation() { return modulation; }

    /**
     * First slot above the reserved range.
     */
    public int getEndSlot() {
        return startSlot + slotCount;
    }

    /**
     * Release this circuit's slots from the ledger.
     */
    public void releaseFrom(SpectrumLedger ledger) {
        ledger.release(links, startSlot, slotCount);
    }

    @Override
    public String toString() {
        return String.format("Circuit[%s via %s, links=%s, slots=[%d,%d), %s]",
            demand.getId(), path, Arrays.toString(links), startSlot, getEndSlot(), modulation.getName());
    }
}
