package org.carma.spectrum.config;

import org.carma.spectrum.model.ModulationFormat;
import org.carma.spectrum.network.*;
import org.carma.spectrum.simulation.ExperimentRunner;
import org.carma.spectrum.simulation.DemandGenerator;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.LoaderOptions;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads experiment scenarios from YAML files.
 *
 * A scenario consists of:
 * - Topology (a named preset or an explicit link list)
 * - Spectrum settings (slots, slot width, guard band, modulation formats)
 * - Adaptive allocator settings (path counts, load thresholds, offset limits)
 * - Experiment settings (demand loads, runs per load, bandwidth range)
 *
 * Directory structure:
 * <pre>
 * scenarios/
 *   nsfnet/
 *     scenario.yaml
 * </pre>
 *
 * Every section is optional; missing keys fall back to {@link SpectrumConfig#DEFAULT}
 * and the {@link ExperimentRunner} defaults.
 */
public class ScenarioConfigLoader {

    public static final String SCENARIO_FILE = "scenario.yaml";

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a scenario.
     */
    public static class ScenarioConfig {
        public String name;
        public String description;
        public TopologyConfig topology;
        public SpectrumSection spectrum;
        public AdaptiveSection adaptive;
        public ExperimentSection experiment;

        @Override
        public String toString() {
            return String.format("ScenarioConfig[name=%s, topology=%s]", name, topology);
        }
    }

    /**
     * Either a preset name or explicit links, each written as [nodeA, nodeB, km].
     */
    public static class TopologyConfig {
        public String preset;
        public List<LinkConfig> links = new ArrayList<>();

        public static class LinkConfig {
            public String nodeA;
            public String nodeB;
            public double distanceKm;
        }

        @Override
        public String toString() {
            return preset != null ? preset : links.size() + " links";
        }
    }

    public static class SpectrumSection {
        public int slotCapacity = SpectrumConfig.DEFAULT_SLOT_CAPACITY;
        public double slotWidthGhz = SpectrumConfig.DEFAULT.getSlotWidthGhz();
        public int guardBandSlots = SpectrumConfig.DEFAULT.getGuardBandSlots();
        public List<ModulationFormat> modulationFormats;   // null = default table
    }

    public static class AdaptiveSection {
        public int defaultPathCount = SpectrumConfig.DEFAULT.getDefaultPathCount();
        public int highLoadPathCount = SpectrumConfig.DEFAULT.getHighLoadPathCount();
        public int extremeLoadPathCount = SpectrumConfig.DEFAULT.getExtremeLoadPathCount();
        public double highWatermarkRatio = SpectrumConfig.DEFAULT.getHighWatermarkRatio();
        public double highUtilization = SpectrumConfig.DEFAULT.getHighUtilization();
        public double extremeWatermarkRatio = SpectrumConfig.DEFAULT.getExtremeWatermarkRatio();
        public double extremeUtilization = SpectrumConfig.DEFAULT.getExtremeUtilization();
        public int normalOffsetLimit = SpectrumConfig.DEFAULT.getNormalOffsetLimit();
        public int highOffsetLimit = SpectrumConfig.DEFAULT.getHighOffsetLimit();
    }

    public static class ExperimentSection {
        public List<Integer> demandLoads = ExperimentRunner.DEFAULT_DEMAND_LOADS;
        public int runsPerLoad = ExperimentRunner.DEFAULT_RUNS_PER_LOAD;
        public double minBandwidthGbps = DemandGenerator.DEFAULT_MIN_BANDWIDTH_GBPS;
        public double maxBandwidthGbps = DemandGenerator.DEFAULT_MAX_BANDWIDTH_GBPS;
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public ScenarioConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a scenario from a directory containing scenario.yaml.
     */
    public ScenarioConfig loadScenario(Path scenarioDir) throws IOException {
        Path scenarioFile = scenarioDir.resolve(SCENARIO_FILE);
        if (!Files.exists(scenarioFile)) {
            throw new IOException(SCENARIO_FILE + " not found in: " + scenarioDir);
        }

        try (InputStream is = Files.newInputStream(scenarioFile)) {
            return load(is, scenarioFile.toString());
        }
    }

    /**
     * Load a scenario bundled on the classpath, e.g. "scenarios/nsfnet".
     */
    public ScenarioConfig loadBundled(String scenarioName) throws IOException {
        String resource = "scenarios/" + scenarioName + "/" + SCENARIO_FILE;
        try (InputStream is = ScenarioConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Bundled scenario not found: " + resource);
            }
            return load(is, resource);
        }
    }

    public ScenarioConfig load(InputStream is, String source) {
        Object raw = yaml.load(is);
        if (!(raw instanceof Map)) {
            throw new ConfigValidationException(source, List.of("top level must be a mapping"));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> root = (Map<String, Object>) raw;

        List<String> errors = new ArrayList<>();
        ScenarioConfig config = parseScenarioConfig(root, errors);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(source, errors);
        }
        return config;
    }

    /**
     * Parse raw YAML into ScenarioConfig, collecting problems instead of stopping at the first.
     */
    @SuppressWarnings("unchecked")
    private ScenarioConfig parseScenarioConfig(Map<String, Object> raw, List<String> errors) {
        ScenarioConfig config = new ScenarioConfig();

        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");

        // Topology
        config.topology = new TopologyConfig();
        Map<String, Object> topoMap = (Map<String, Object>) raw.get("topology");
        if (topoMap == null) {
            config.topology.preset = "nsfnet";
        } else {
            config.topology.preset = getString(topoMap, "preset");
            List<Object> linkList = (List<Object>) topoMap.get("links");
            if (linkList != null) {
                for (Object entry : linkList) {
                    TopologyConfig.LinkConfig link = parseLink(entry, errors);
                    if (link != null) {
                        config.topology.links.add(link);
                    }
                }
            }
            if (config.topology.preset == null && config.topology.links.isEmpty()) {
                errors.add("topology needs a preset or at least one link");
            }
            if (config.topology.preset != null && !config.topology.links.isEmpty()) {
                errors.add("topology cannot have both a preset and links");
            }
        }

        // Spectrum
        config.spectrum = new SpectrumSection();
        Map<String, Object> specMap = (Map<String, Object>) raw.get("spectrum");
        if (specMap != null) {
            config.spectrum.slotCapacity = getInt(specMap, "slotCapacity", config.spectrum.slotCapacity);
            config.spectrum.slotWidthGhz = getDouble(specMap, "slotWidthGhz", config.spectrum.slotWidthGhz);
            config.spectrum.guardBandSlots = getInt(specMap, "guardBandSlots", config.spectrum.guardBandSlots);

            List<Map<String, Object>> formats = (List<Map<String, Object>>) specMap.get("modulationFormats");
            if (formats != null) {
                config.spectrum.modulationFormats = new ArrayList<>();
                for (Map<String, Object> fmt : formats) {
                    try {
                        config.spectrum.modulationFormats.add(new ModulationFormat(
                            getString(fmt, "name"),
                            getDouble(fmt, "maxReachKm", 0),
                            getDouble(fmt, "spectralEfficiency", 0)));
                    } catch (IllegalArgumentException e) {
                        errors.add("modulationFormats: " + e.getMessage());
                    }
                }
            }
        }

        // Adaptive allocator
        config.adaptive = new AdaptiveSection();
        Map<String, Object> adaptMap = (Map<String, Object>) raw.get("adaptive");
        if (adaptMap != null) {
            AdaptiveSection a = config.adaptive;
            a.defaultPathCount = getInt(adaptMap, "defaultPathCount", a.defaultPathCount);
            a.highLoadPathCount = getInt(adaptMap, "highLoadPathCount", a.highLoadPathCount);
            a.extremeLoadPathCount = getInt(adaptMap, "extremeLoadPathCount", a.extremeLoadPathCount);
            a.highWatermarkRatio = getDouble(adaptMap, "highWatermarkRatio", a.highWatermarkRatio);
            a.highUtilization = getDouble(adaptMap, "highUtilization", a.highUtilization);
            a.extremeWatermarkRatio = getDouble(adaptMap, "extremeWatermarkRatio", a.extremeWatermarkRatio);
            a.extremeUtilization = getDouble(adaptMap, "extremeUtilization", a.extremeUtilization);
            a.normalOffsetLimit = getInt(adaptMap, "normalOffsetLimit", a.normalOffsetLimit);
            a.highOffsetLimit = getInt(adaptMap, "highOffsetLimit", a.highOffsetLimit);
        }

        // Experiment
        config.experiment = new ExperimentSection();
        Map<String, Object> expMap = (Map<String, Object>) raw.get("experiment");
        if (expMap != null) {
            ExperimentSection e = config.experiment;
            List<Object> loads = (List<Object>) expMap.get("demandLoads");
            if (loads != null) {
                e.demandLoads = new ArrayList<>();
                for (Object load : loads) {
                    if (load instanceof Number && ((Number) load).intValue() >= 0) {
                        e.demandLoads.add(((Number) load).intValue());
                    } else {
                        errors.add("demandLoads entries must be non-negative integers, got " + load);
                    }
                }
            }
            e.runsPerLoad = getInt(expMap, "runsPerLoad", e.runsPerLoad);
            e.minBandwidthGbps = getDouble(expMap, "minBandwidthGbps", e.minBandwidthGbps);
            e.maxBandwidthGbps = getDouble(expMap, "maxBandwidthGbps", e.maxBandwidthGbps);
            if (e.runsPerLoad < 1) {
                errors.add("runsPerLoad must be at least 1, got " + e.runsPerLoad);
            }
            if (e.minBandwidthGbps <= 0 || e.maxBandwidthGbps < e.minBandwidthGbps) {
                errors.add(String.format("bandwidth range [%s, %s] is invalid",
                    e.minBandwidthGbps, e.maxBandwidthGbps));
            }
        }

        return config;
    }

    @SuppressWarnings("unchecked")
    private TopologyConfig.LinkConfig parseLink(Object entry, List<String> errors) {
        if (!(entry instanceof List) || ((List<Object>) entry).size() != 3
                || !(((List<Object>) entry).get(2) instanceof Number)) {
            errors.add("link must be [nodeA, nodeB, distanceKm], got " + entry);
            return null;
        }
        List<Object> parts = (List<Object>) entry;
        TopologyConfig.LinkConfig link = new TopologyConfig.LinkConfig();
        link.nodeA = String.valueOf(parts.get(0));
        link.nodeB = String.valueOf(parts.get(1));
        link.distanceKm = ((Number) parts.get(2)).doubleValue();
        return link;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build the network graph from scenario configuration.
     */
    public NetworkGraph buildGraph(ScenarioConfig config) {
        TopologyConfig topo = config.topology;
        if (topo.preset != null) {
            switch (topo.preset.toLowerCase()) {
                case "nsfnet":
                    return Topologies.nsfnet();
                default:
                    throw new ConfigValidationException(config.name,
                        List.of("unknown topology preset: " + topo.preset));
            }
        }

        NetworkGraph graph = new NetworkGraph();
        List<String> errors = new ArrayList<>();
        for (TopologyConfig.LinkConfig link : topo.links) {
            try {
                graph.addLink(link.nodeA, link.nodeB, link.distanceKm);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(config.name, errors);
        }
        return graph;
    }

    /**
     * Build SpectrumConfig from scenario configuration.
     * @throws ConfigValidationException if the combined settings are invalid
     */
    public SpectrumConfig buildSpectrumConfig(ScenarioConfig config) {
        SpectrumConfig.Builder builder = new SpectrumConfig.Builder()
            .slotCapacity(config.spectrum.slotCapacity)
            .slotWidthGhz(config.spectrum.slotWidthGhz)
            .guardBandSlots(config.spectrum.guardBandSlots);
        if (config.spectrum.modulationFormats != null) {
            builder.modulationFormats(config.spectrum.modulationFormats);
        }

        AdaptiveSection a = config.adaptive;
        return builder
            .defaultPathCount(a.defaultPathCount)
            .highLoadPathCount(a.highLoadPathCount)
            .extremeLoadPathCount(a.extremeLoadPathCount)
            .highLoadThresholds(a.highWatermarkRatio, a.highUtilization)
            .extremeLoadThresholds(a.extremeWatermarkRatio, a.extremeUtilization)
            .offsetLimits(a.normalOffsetLimit, a.highOffsetLimit)
            .build();
    }

    /**
     * Build an experiment runner comparing first-fit against the adaptive allocator.
     */
    public ExperimentRunner buildExperiment(ScenarioConfig config) {
        NetworkGraph graph = buildGraph(config);
        SpectrumConfig spectrumConfig = buildSpectrumConfig(config);
        return new ExperimentRunner(graph, spectrumConfig)
            .setDemandLoads(config.experiment.demandLoads)
            .setRunsPerLoad(config.experiment.runsPerLoad)
            .setBandwidthRange(config.experiment.minBandwidthGbps, config.experiment.maxBandwidthGbps);
    }

    // ========================================================================
    // UTILITY METHODS
    // ========================================================================

    /**
     * List scenario directories (those holding a scenario.yaml) under a root.
     */
    public List<String> listScenarios(Path scenariosDir) throws IOException {
        if (!Files.exists(scenariosDir)) {
            return Collections.emptyList();
        }

        List<String> scenarios = new ArrayList<>();
        try (var stream = Files.list(scenariosDir)) {
            stream.filter(Files::isDirectory)
                  .filter(p -> Files.exists(p.resolve(SCENARIO_FILE)))
                  .map(p -> p.getFileName().toString())
                  .sorted()
                  .forEach(scenarios::add);
        }
        return scenarios;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key) {
        return getString(map, key, null);
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }
}
