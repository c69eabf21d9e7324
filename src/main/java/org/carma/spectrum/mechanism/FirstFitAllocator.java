package org.carma.spectrum.mechanism;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.*;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Shortest-Path First-Fit (SPFF) baseline.
 *
 * For each demand:
 * 1. Take the single least-distance path
 * 2. Size the demand with the most efficient modulation that reaches it
 * 3. Commit the lowest free window common to every link of the path
 *
 * There is no retry on an alternate path; anything that fails blocks the demand.
 */
public class FirstFitAllocator implements SpectrumAllocator {

    public static final String NAME = "SPFF";

    private final NetworkGraph graph;
    private final PathFinder pathFinder;
    private final ModulationTable modulationTable;

    public FirstFitAllocator(NetworkGraph graph, PathFinder pathFinder, SpectrumConfig config) {
        this.graph = graph;
        this.pathFinder = pathFinder;
        this.modulationTable = config.getModulationTable();
    }

    public FirstFitAllocator(NetworkGraph graph) {
        this(graph, new YenPathFinder(), SpectrumConfig.DEFAULT);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AllocationOutcome allocate(Demand demand, SpectrumLedger ledger) {
        Optional<NetworkPath> shortest = pathFinder.shortestPath(graph, demand.getOrigin(), demand.getDestination());
        if (shortest.isEmpty()) {
            return AllocationOutcome.blocked(demand, BlockReason.NO_PATH, null);
        }
        NetworkPath path = shortest.get();

        ModulationFormat modulation = modulationTable.select(path.getDistanceKm());
        int slots = modulationTable.requiredSlots(demand.getBandwidthGbps(), modulation);

        Optional<int[]> links = ledger.resolveLinks(path);
        if (links.isEmpty()) {
            return AllocationOutcome.blocked(demand, BlockReason.UNRESOLVED_LINK, null);
        }

        OptionalInt start = ledger.findFirstFit(links.get(), slots);
        if (start.isEmpty()) {
            return AllocationOutcome.blocked(demand, BlockReason.NO_SPECTRUM, null);
        }
        if (!ledger.commit(links.get(), start.getAsInt(), slots)) {
            return AllocationOutcome.blocked(demand, BlockReason.COMMIT_CONFLICT, null);
        }

        Circuit circuit = new Circuit(demand, path, links.get(), start.getAsInt(), slots, modulation);
        return AllocationOutcome.established(circuit, null);
    }
}
