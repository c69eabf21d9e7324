package org.carma.spectrum.simulation;

import org.carma.spectrum.config.SpectrumConfig;
import org.carma.spectrum.event.EventBus;
import org.carma.spectrum.mechanism.*;
import org.carma.spectrum.model.Demand;
import org.carma.spectrum.network.*;
import org.carma.spectrum.runner.DemandScheduler;
import org.carma.spectrum.runner.DemandScheduler.ComparisonResult;

import java.util.*;

/**
 * Repeated comparison of a baseline and a candidate allocator over growing demand loads.
 *
 * For every load L and run r in [0, runsPerLoad), L demands are drawn with
 * seed r, then both allocators process them on independent ledgers. Run r of
 * every load therefore shares one random stream, which keeps loads comparable.
 */
public class ExperimentRunner {

    public static final List<Integer> DEFAULT_DEMAND_LOADS = List.of(50, 100, 150, 200);
    public static final int DEFAULT_RUNS_PER_LOAD = 5;

    private final NetworkGraph graph;
    private final DemandScheduler scheduler;
    private final SpectrumAllocator baseline;
    private final SpectrumAllocator candidate;

    private List<Integer> demandLoads = DEFAULT_DEMAND_LOADS;
    private int runsPerLoad = DEFAULT_RUNS_PER_LOAD;
    private double minBandwidthGbps = DemandGenerator.DEFAULT_MIN_BANDWIDTH_GBPS;
    private double maxBandwidthGbps = DemandGenerator.DEFAULT_MAX_BANDWIDTH_GBPS;
    private boolean verbose = false;

    /**
     * Shortest-path first-fit against the load-adaptive allocator, both over Yen's k paths.
     */
    public ExperimentRunner(NetworkGraph graph, SpectrumConfig config) {
        this(graph, config,
            new FirstFitAllocator(graph, new YenPathFinder(), config),
            new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config));
    }

    public ExperimentRunner(NetworkGraph graph, SpectrumConfig config,
                            SpectrumAllocator baseline, SpectrumAllocator candidate) {
        this.graph = graph;
        this.scheduler = new DemandScheduler(graph, config);
        this.baseline = baseline;
        this.candidate = candidate;
    }

    // ========================================================================
    // Configuration
    // ========================================================================

    public ExperimentRunner setDemandLoads(List<Integer> demandLoads) {
        for (int load : demandLoads) {
            if (load < 0) {
                throw new IllegalArgumentException("Demand load must be non-negative: " + load);
            }
        }
        this.demandLoads = List.copyOf(demandLoads);
        return this;
    }

    public ExperimentRunner setRunsPerLoad(int runsPerLoad) {
        if (runsPerLoad < 1) {
            throw new IllegalArgumentException("Runs per load must be at least 1: " + runsPerLoad);
        }
        this.runsPerLoad = runsPerLoad;
        return this;
    }

    public ExperimentRunner setBandwidthRange(double minGbps, double maxGbps) {
        this.minBandwidthGbps = minGbps;
        this.maxBandwidthGbps = maxGbps;
        return this;
    }

    public ExperimentRunner setEventBus(EventBus eventBus) {
        scheduler.eventBus(eventBus);
        return this;
    }

    public ExperimentRunner setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // ========================================================================
    // Execution
    // ========================================================================

    public ExperimentMetrics run() {
        ExperimentMetrics metrics = new ExperimentMetrics();

        log("Starting experiment: " + baseline.getName() + " vs " + candidate.getName());
        log("  Topology: " + graph);
        log("  Loads: " + demandLoads + ", runs per load: " + runsPerLoad);

        for (int load : demandLoads) {
            for (int run = 0; run < runsPerLoad; run++) {
                DemandGenerator generator = new DemandGenerator(graph, run, minBandwidthGbps, maxBandwidthGbps);
                List<Demand> demands = generator.generate(load);

                ComparisonResult result = scheduler.compare(demands, baseline, candidate);
                metrics.record(load, result);

                log(String.format("  load=%d run=%d: watermark %d vs %d, blocking %.3f vs %.3f",
                    load, run,
                    result.baseline.getWatermark(), result.candidate.getWatermark(),
                    result.baseline.getBlockingProbability(), result.candidate.getBlockingProbability()));
            }
        }

        log("Experiment complete: " + metrics);
        return metrics;
    }

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    public List<Integer> getDemandLoads() {
        return demandLoads;
    }

    public int getRunsPerLoad() {
        return runsPerLoad;
    }
}
