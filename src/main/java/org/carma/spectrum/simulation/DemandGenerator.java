package org.carma.spectrum.simulation;

import org.carma.spectrum.model.Demand;
import org.carma.spectrum.network.NetworkGraph;

import java.util.*;

/**
 * Seeded random traffic for experiments.
 *
 * Each demand picks a uniform origin, a uniform destination distinct from it,
 * and a bandwidth uniform in [min, max] Gbps. The same seed over the same
 * graph always yields the same sequence.
 */
public class DemandGenerator {

    public static final double DEFAULT_MIN_BANDWIDTH_GBPS = 50.0;
    public static final double DEFAULT_MAX_BANDWIDTH_GBPS = 400.0;

    private final List<String> nodes;
    private final Random random;
    private final double minBandwidthGbps;
    private final double maxBandwidthGbps;

    public DemandGenerator(NetworkGraph graph, long seed) {
        this(graph, seed, DEFAULT_MIN_BANDWIDTH_GBPS, DEFAULT_MAX_BANDWIDTH_GBPS);
    }

    public DemandGenerator(NetworkGraph graph, long seed, double minBandwidthGbps, double maxBandwidthGbps) {
        if (graph.getNodeCount() < 2) {
            throw new IllegalArgumentException(
                "Need at least 2 nodes to generate demands, graph has " + graph.getNodeCount());
        }
        if (minBandwidthGbps <= 0 || maxBandwidthGbps < minBandwidthGbps) {
            throw new IllegalArgumentException(String.format(
                "Invalid bandwidth range [%.1f, %.1f] Gbps", minBandwidthGbps, maxBandwidthGbps));
        }
        this.nodes = new ArrayList<>(graph.getNodes());
        this.random = new Random(seed);
        this.minBandwidthGbps = minBandwidthGbps;
        this.maxBandwidthGbps = maxBandwidthGbps;
    }

    public List<Demand> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Demand count must be non-negative: " + count);
        }
        List<Demand> demands = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String origin = nodes.get(random.nextInt(nodes.size()));
            String destination = origin;
            while (destination.equals(origin)) {
                destination = nodes.get(random.nextInt(nodes.size()));
            }
            double bandwidth = minBandwidthGbps + random.nextDouble() * (maxBandwidthGbps - minBandwidthGbps);
            demands.add(new Demand("D" + (i + 1), origin, destination, bandwidth));
        }
        return demands;
    }

    public double getMinBandwidthGbps() {
        return minBandwidthGbps;
    }

    public double getMaxBandwidthGbps() {
        return maxBandwidthGbps;
    }
}
