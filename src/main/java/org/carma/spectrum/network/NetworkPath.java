package org.carma.spectrum.network;

import java.util.List;

/**
 * A loop-free node sequence through the network with its total distance.
 */
public final class NetworkPath {

    private final List<String> nodes;
    private final double distanceKm;

    public NetworkPath(List<String> nodes, double distanceKm) {
        if (nodes == null || nodes.size() < 2) {
            throw new IllegalArgumentException("A path needs at least two nodes: " + nodes);
        }
        this.nodes = List.copyOf(nodes);
        this.distanceKm = distanceKm;
    }

    public List<String> getNodes() {
        return nodes;
    }

    public String getOrigin() {
        return nodes.get(0);
    }

    public String getDestination() {
        return nodes.get(nodes.size() - 1);
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    /**
     * Number of links traversed.
     */
    public int getHopCount() {
        return nodes.size() - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkPath)) return false;
        return nodes.equals(((NetworkPath) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return String.join("-", nodes) + String.format(" (%.0f km)", distanceKm);
    }
}
