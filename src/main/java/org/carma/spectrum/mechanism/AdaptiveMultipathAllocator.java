package org.carma.spectrum.mechanism;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.*;

import java.util.*;

/**
 * Load-adaptive k-shortest-paths minimum-watermark allocator (k-SP-MW).
 *
 * Before every demand the current ledger is read for two load signals:
 * <pre>
 *   watermarkRatio = watermark / capacity
 *   utilization    = occupied cells / all cells
 * </pre>
 * which select a {@link LoadMode}. The mode fixes how many candidate paths are
 * searched, how many offsets per path, and how candidates are ranked:
 *
 * | Mode | Paths | Offsets | Ranking |
 * |------|-------|---------|---------|
 * | NORMAL | k | best-fit, up to 10 | {@link PlacementCandidate#WATERMARK_ORDER} |
 * | HIGH | 5 | best-fit, up to 3 | {@link PlacementCandidate#SHORT_PATH_ORDER} |
 * | EXTREME | 3 | first-fit | first feasible candidate wins |
 *
 * The best candidate over all paths and offsets is committed. If that commit
 * fails the demand is blocked; the runner-up is not tried.
 */
public class AdaptiveMultipathAllocator implements SpectrumAllocator {

    public static final String NAME = "k-SP-MW";

    private final NetworkGraph graph;
    private final PathFinder pathFinder;
    private final SpectrumConfig config;
    private final ModulationTable modulationTable;

    public AdaptiveMultipathAllocator(NetworkGraph graph, PathFinder pathFinder, SpectrumConfig config) {
        this.graph = graph;
        this.pathFinder = pathFinder;
        this.config = config;
        this.modulationTable = config.getModulationTable();
    }

    public AdaptiveMultipathAllocator(NetworkGraph graph) {
        this(graph, new YenPathFinder(), SpectrumConfig.DEFAULT);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Mode the next demand would be handled in, given the ledger as it stands.
     */
    public LoadMode currentMode(SpectrumLedger ledger) {
        return LoadMode.select(ledger.getWatermarkRatio(), ledger.utilization(), config);
    }

    @Override
    public AllocationOutcome allocate(Demand demand, SpectrumLedger ledger) {
        LoadMode mode = currentMode(ledger);

        List<NetworkPath> paths = pathFinder.findPaths(
            graph, demand.getOrigin(), demand.getDestination(), mode.pathCount(config));
        if (paths.isEmpty()) {
            return AllocationOutcome.blocked(demand, BlockReason.NO_PATH, mode);
        }

        Optional<PlacementCandidate> chosen = mode == LoadMode.EXTREME
            ? firstFeasible(demand, paths, ledger)
            : bestCandidate(demand, paths, ledger, mode);

        if (chosen.isEmpty()) {
            BlockReason reason = anyResolvable(paths, ledger) ? BlockReason.NO_SPECTRUM : BlockReason.UNRESOLVED_LINK;
            return AllocationOutcome.blocked(demand, reason, mode);
        }

        PlacementCandidate best = chosen.get();
        if (!ledger.commit(best.linksForCommit(), best.getStartSlot(), best.getSlotCount())) {
            return AllocationOutcome.blocked(demand, BlockReason.COMMIT_CONFLICT, mode);
        }
        return AllocationOutcome.established(best.toCircuit(demand), mode);
    }

    // ========================================================================
    // Candidate Search
    // ========================================================================

    /**
     * Evaluate every path and its best-fit offsets, keep the minimum under the
     * mode's ordering. Earlier candidates win exact ties.
     */
    private Optional<PlacementCandidate> bestCandidate(Demand demand, List<NetworkPath> paths,
                                                       SpectrumLedger ledger, LoadMode mode) {
        Comparator<PlacementCandidate> order = mode == LoadMode.HIGH
            ? PlacementCandidate.SHORT_PATH_ORDER
            : PlacementCandidate.WATERMARK_ORDER;
        int offsetLimit = mode.offsetLimit(config);

        PlacementCandidate best = null;
        for (NetworkPath path : paths) {
            Optional<int[]> links = ledger.resolveLinks(path);
            if (links.isEmpty()) continue;

            ModulationFormat modulation = modulationTable.select(path.getDistanceKm());
            int slots = modulationTable.requiredSlots(demand.getBandwidthGbps(), modulation);

            for (int start : ledger.findBestFitPositions(links.get(), slots, offsetLimit)) {
                PlacementCandidate candidate =
                    PlacementCandidate.evaluate(ledger, path, links.get(), start, slots, modulation);
                if (best == null || order.compare(candidate, best) < 0) {
                    best = candidate;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Saturated network: stop at the first path with a first-fit window.
     */
    private Optional<PlacementCandidate> firstFeasible(Demand demand, List<NetworkPath> paths,
                                                       SpectrumLedger ledger) {
        for (NetworkPath path : paths) {
            Optional<int[]> links = ledger.resolveLinks(path);
            if (links.isEmpty()) continue;

            ModulationFormat modulation = modulationTable.select(path.getDistanceKm());
            int slots = modulationTable.requiredSlots(demand.getBandwidthGbps(), modulation);

            OptionalInt start = ledger.findFirstFit(links.get(), slots);
            if (start.isPresent()) {
                return Optional.of(PlacementCandidate.evaluate(
                    ledger, path, links.get(), start.getAsInt(), slots, modulation));
            }
        }
        return Optional.empty();
    }

    private boolean anyResolvable(List<NetworkPath> paths, SpectrumLedger ledger) {
        for (NetworkPath path : paths) {
            if (ledger.resolveLinks(path).isPresent()) {
                return true;
            }
        }
        return false;
    }

    public SpectrumConfig getConfig() {
        return config;
    }
}
