package org.carma.spectrum;

import org.carma.spectrum.config.*;
import org.carma.spectrum.config.ScenarioConfigLoader.ScenarioConfig;
import org.carma.spectrum.event.*;
import org.carma.spectrum.mechanism.*;
import org.carma.spectrum.model.Demand;
import org.carma.spectrum.network.*;
import org.carma.spectrum.runner.*;
import org.carma.spectrum.runner.DemandScheduler.ComparisonResult;
import org.carma.spectrum.simulation.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * Command-line demonstration of the spectrum allocation engine.
 *
 * Runs two parts:
 * 1. A single batch of the scenario's smallest load, with load-mode changes and
 *    blocking reasons reported as events
 * 2. The full experiment: every load, several seeded runs, averaged per load
 *
 * Usage:
 *   java SpectrumDemo                         # bundled NSFNET scenario
 *   java SpectrumDemo --scenario path/to/dir  # directory holding scenario.yaml
 *   java SpectrumDemo --quiet                 # summary tables only
 */
public class SpectrumDemo {

    private static final String SEP = "═".repeat(72);
    private static final String SUBSEP = "─".repeat(60);

    public static void main(String[] args) {
        List<String> argList = Arrays.asList(args);
        boolean quiet = argList.contains("--quiet");

        ScenarioConfigLoader loader = new ScenarioConfigLoader();
        ScenarioConfig scenario;
        NetworkGraph graph;
        SpectrumConfig config;
        try {
            scenario = loadScenario(loader, argList);
            graph = loader.buildGraph(scenario);
            config = loader.buildSpectrumConfig(scenario);
        } catch (IOException e) {
            System.err.println("Could not read scenario: " + e.getMessage());
            System.exit(1);
            return;
        } catch (ConfigValidationException e) {
            System.err.println("Invalid scenario '" + e.getSource() + "':");
            e.getErrors().forEach(err -> System.err.println("  - " + err));
            System.exit(1);
            return;
        }

        System.out.println(SEP);
        System.out.println("   ELASTIC OPTICAL NETWORK SPECTRUM ALLOCATION");
        System.out.println("   " + FirstFitAllocator.NAME + " vs " + AdaptiveMultipathAllocator.NAME
            + " on scenario '" + scenario.name + "'");
        System.out.println(SEP);
        System.out.println("Topology: " + graph);
        System.out.println("Config:   " + config);
        System.out.println();

        runSingleBatch(graph, config, scenario, quiet);
        runExperiment(loader, scenario, quiet);

        System.out.println(SEP);
        System.out.println("   DEMONSTRATION COMPLETE");
        System.out.println(SEP);
    }

    private static ScenarioConfig loadScenario(ScenarioConfigLoader loader, List<String> args) throws IOException {
        int idx = args.indexOf("--scenario");
        if (idx < 0) {
            return loader.loadBundled("nsfnet");
        }
        if (idx + 1 >= args.size()) {
            throw new IOException("--scenario requires a directory argument");
        }
        return loader.loadScenario(Paths.get(args.get(idx + 1)));
    }

    // ========================================================================
    // PART 1: Single batch with events
    // ========================================================================

    static void runSingleBatch(NetworkGraph graph, SpectrumConfig config, ScenarioConfig scenario, boolean quiet) {
        int load = scenario.experiment.demandLoads.isEmpty()
            ? 0 : Collections.min(scenario.experiment.demandLoads);

        System.out.println("PART 1: SINGLE BATCH (" + load + " demands, seed 0)");
        System.out.println(SUBSEP);

        EventBus bus = new EventBus();
        if (!quiet) {
            bus.subscribe(Event.LoadModeChangedEvent.class, e ->
                System.out.printf("  [%s] demand #%d: %s -> %s%n",
                    e.algorithm(), e.demandIndex(), e.previous(), e.current()));
            bus.subscribe(Event.DemandBlockedEvent.class, e ->
                System.out.printf("  [%s] blocked %s (%s)%n",
                    e.algorithm(), e.demandId(), e.reason().getDisplayName()));
        }

        List<Demand> demands = new DemandGenerator(graph, 0,
            scenario.experiment.minBandwidthGbps, scenario.experiment.maxBandwidthGbps).generate(load);
        DemandScheduler scheduler = new DemandScheduler(graph, config).eventBus(bus);
        ComparisonResult result = scheduler.compare(demands,
            new FirstFitAllocator(graph, new YenPathFinder(), config),
            new AdaptiveMultipathAllocator(graph, new YenPathFinder(), config));

        System.out.println();
        System.out.print(result.baseline);
        System.out.print(result.candidate);
        System.out.println(result);
        System.out.println("Events published: " + bus.getEventCount()
            + " (" + bus.getEventCount(Event.CircuitEstablishedEvent.class) + " circuits)");
        System.out.println();
    }

    // ========================================================================
    // PART 2: Full experiment
    // ========================================================================

    static void runExperiment(ScenarioConfigLoader loader, ScenarioConfig scenario, boolean quiet) {
        System.out.println("PART 2: EXPERIMENT");
        System.out.println(SUBSEP);

        ExperimentMetrics metrics = loader.buildExperiment(scenario)
            .setVerbose(!quiet)
            .run();

        System.out.println();
        System.out.println(metrics.getSummary());
    }
}
