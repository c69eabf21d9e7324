package org.carma.spectrum.mechanism;

import org.carma.spectrum.model.*;

import java.util.Optional;

/**
 * Result of allocating one demand: a committed circuit or a block reason,
 * plus the load mode the decision was taken in when the strategy has one.
 */
public final class AllocationOutcome {

    private final Demand demand;
    private final Circuit circuit;
    private final BlockReason blockReason;
    private final LoadMode loadMode;

    private AllocationOutcome(Demand demand, Circuit circuit, BlockReason blockReason, LoadMode loadMode) {
        this.demand = demand;
        this.circuit = circuit;
        this.blockReason = blockReason;
        this.loadMode = loadMode;
    }

    public static AllocationOutcome established(Circuit circuit, LoadMode loadMode) {
        return new AllocationOutcome(circuit.getDemand(), circuit, null, loadMode);
    }

    public static AllocationOutcome blocked(Demand demand, BlockReason reason, LoadMode loadMode) {
        return new AllocationOutcome(demand, null, reason, loadMode);
    }

    public Demand getDemand() { return demand; }

    public boolean isEstablished() {
        return circuit != null;
    }

    public Optional<Circuit> getCircuit() {
        return Optional.ofNullable(circuit);
    }

    public Optional<BlockReason> getBlockReason() {
        return Optional.ofNullable(blockReason);
    }

    public Optional<LoadMode> getLoadMode() {
        return Optional.ofNullable(loadMode);
    }

    @Override
    public String toString() {
        String mode = loadMode != null ? ", mode=" + loadMode : "";
        return isEstablished()
            ? "Established[" + circuit + mode + "]"
            : "Blocked[" + demand.getId() + ": " + blockReason + mode + "]";
    }
}
