package org.carma.spectrum.runner;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.event.*;
import org.carma.spectrum.mechanism.*;
import org.carma.spectrum.model.*;
import org.carma.spectrum.network.NetworkGraph;

import java.time.Instant;
import java.util.*;

/**
 * Runs a batch of demands through one allocator.
 *
 * Key features:
 * - Stable sort by descending bandwidth before dispatch
 * - Strictly sequential processing, no retry queue
 * - A fresh ledger per run unless the caller supplies one
 * - Head-to-head comparison of two allocators on independent ledgers
 *
 * Usage:
 * <pre>
 * DemandScheduler scheduler = new DemandScheduler(graph, SpectrumConfig.DEFAULT);
 * ComparisonResult result = scheduler.compare(demands,
 *     new FirstFitAllocator(graph), new AdaptiveMultipathAllocator(graph));
 * System.out.println(result);
 * </pre>
 */
public class DemandScheduler {

    /** Descending bandwidth. List.sort is stable, so equal demands keep their order. */
    private static final Comparator<Demand> BY_BANDWIDTH_DESC =
        Comparator.comparingDouble(Demand::getBandwidthGbps).reversed();

    private final NetworkGraph graph;
    private final SpectrumConfig config;
    private EventBus eventBus;
    private boolean verbose = false;

    public DemandScheduler(NetworkGraph graph, SpectrumConfig config) {
        this.graph = graph;
        this.config = config;
    }

    public DemandScheduler eventBus(EventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public DemandScheduler verbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Demands in processing order.
     */
    public static List<Demand> sortByBandwidth(List<Demand> demands) {
        List<Demand> sorted = new ArrayList<>(demands);
        sorted.sort(BY_BANDWIDTH_DESC);
        return sorted;
    }

    /**
     * An empty ledger over this scheduler's graph.
     */
    public SpectrumLedger newLedger() {
        return new SpectrumLedger(graph, config.getSlotCapacity());
    }

    /**
     * Run the batch on a fresh ledger.
     */
    public BatchResult run(List<Demand> demands, SpectrumAllocator allocator) {
        return run(demands, allocator, newLedger());
    }

    /**
     * Run the batch on the given ledger, which this run then owns.
     */
    public BatchResult run(List<Demand> demands, SpectrumAllocator allocator, SpectrumLedger ledger) {
        long startTime = System.currentTimeMillis();
        String algorithm = allocator.getName();
        BatchResult result = new BatchResult(algorithm);

        List<Demand> ordered = sortByBandwidth(demands);
        log(algorithm + ": processing " + ordered.size() + " demands");

        LoadMode lastMode = null;
        for (int i = 0; i < ordered.size(); i++) {
            Demand demand = ordered.get(i);
            AllocationOutcome outcome = allocator.allocate(demand, ledger);
            result.record(outcome);

            LoadMode mode = outcome.getLoadMode().orElse(null);
            if (mode != null && lastMode != null && mode != lastMode) {
                log(String.format("  [%s] load mode %s -> %s at demand %d (watermark=%d, utilization=%.3f)",
                    algorithm, lastMode, mode, i, ledger.getWatermark(), ledger.utilization()));
                publish(new Event.LoadModeChangedEvent(Instant.now(), algorithm, lastMode, mode, i));
            }
            if (mode != null) {
                lastMode = mode;
            }

            if (outcome.isEstablished()) {
                Circuit circuit = outcome.getCircuit().orElseThrow();
                publish(new Event.CircuitEstablishedEvent(Instant.now(), algorithm, demand.getId(),
                    circuit.getPath().getNodes(), circuit.getStartSlot(), circuit.getSlotCount(),
                    circuit.getModulation().getName(), ledger.getWatermark()));
            } else {
                BlockReason reason = outcome.getBlockReason().orElseThrow();
                log("  [" + algorithm + "] blocked " + demand + ": " + reason.getDescription());
                publish(new Event.DemandBlockedEvent(Instant.now(), algorithm, demand.getId(), reason));
            }
        }

        result.complete(ledger, System.currentTimeMillis() - startTime);
        publish(new Event.BatchCompleteEvent(Instant.now(), algorithm, result.getSuccessful(),
            result.getBlocked(), result.getWatermark(), result.getUtilization(), result.getComputationTimeMs()));
        log(String.format("%s: successful=%d, blocked=%d, watermark=%d, utilization=%.4f",
            algorithm, result.getSuccessful(), result.getBlocked(), result.getWatermark(), result.getUtilization()));
        return result;
    }

    /**
     * Run both allocators over the same demands, each on its own ledger.
     */
    public ComparisonResult compare(List<Demand> demands, SpectrumAllocator baseline, SpectrumAllocator candidate) {
        BatchResult first = run(demands, baseline, newLedger());
        BatchResult second = run(demands, candidate, newLedger());
        return new ComparisonResult(first, second);
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Two batch results over the same demand sequence.
     * Improvements are baseline minus candidate, so positive means the candidate did better.
     */
    public static class ComparisonResult {
        public final BatchResult baseline;
        public final BatchResult candidate;

        public ComparisonResult(BatchResult baseline, BatchResult candidate) {
            this.baseline = baseline;
            this.candidate = candidate;
        }

        public int getWatermarkImprovement() {
            return baseline.getWatermark() - candidate.getWatermark();
        }

        public double getBlockingImprovement() {
            return baseline.getBlockingProbability() - candidate.getBlockingProbability();
        }

        @Override
        public String toString() {
            return String.format("Comparison[%s vs %s: watermark %d vs %d (improvement %d), " +
                    "blocking %.3f vs %.3f (improvement %.3f)]",
                baseline.getAlgorithm(), candidate.getAlgorithm(),
                baseline.getWatermark(), candidate.getWatermark(), getWatermarkImprovement(),
                baseline.getBlockingProbability(), candidate.getBlockingProbability(),
                getBlockingImprovement());
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void publish(Event event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    public SpectrumConfig getConfig() {
        return config;
    }

    public NetworkGraph getGraph() {
        return graph;
    }
}
