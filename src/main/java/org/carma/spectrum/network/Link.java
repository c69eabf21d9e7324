package org.carma.spectrum.network;

/**
 * An undirected fiber link between two nodes.
 *
 * The index is the link's position in the graph's insertion order and is the
 * row the spectrum ledger uses for it.
 */
public final class Link {

    private final int index;
    private final String nodeA;
    private final String nodeB;
    private final double distanceKm;

    Link(int index, String nodeA, String nodeB, double distanceKm) {
        this.index = index;
        this.nodeA = nodeA;
        this.nodeB = nodeB;
        this.distanceKm = distanceKm;
    }

    public int getIndex() {
        return index;
    }

    public String getNodeA() {
        return nodeA;
    }

    public String getNodeB() {
        return nodeB;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    /**
     * The endpoint opposite to the given node.
     */
    public String opposite(String node) {
        if (nodeA.equals(node)) return nodeB;
        if (nodeB.equals(node)) return nodeA;
        throw new IllegalArgumentException("Node " + node + " is not an endpoint of " + this);
    }

    public boolean connects(String u, String v) {
        return (nodeA.equals(u) && nodeB.equals(v)) || (nodeA.equals(v) && nodeB.equals(u));
    }

    @Override
    public String toString() {
        return String.format("Link#%d[%s-%s, %.0f km]", index, nodeA, nodeB, distanceKm);
    }
}
