package org.carma.spectrum.network;

/**
 * Reference topologies.
 */
public final class Topologies {

    private Topologies() {}

    /**
     * NSFNET with 14 nodes and 23 bidirectional links, distances in km.
     * Nodes are numbered 0..13.
     */
    public static NetworkGraph nsfnet() {
        NetworkGraph graph = new NetworkGraph();
        for (int i = 0; i < 14; i++) {
            graph.addNode(String.valueOf(i));
        }
        int[][] links = {
            {0, 1, 2100}, {0, 2, 3000}, {0, 6, 4800},
            {1, 2, 1200}, {1, 3, 1500},
            {2, 5, 3600},
            {3, 4, 1200}, {3, 6, 3900},
            {4, 5, 2400}, {4, 6, 1200},
            {5, 6, 2700}, {5, 9, 2100}, {5, 8, 3600},
            {6, 7, 1500},
            {7, 8, 1500}, {7, 10, 1500},
            {8, 9, 1500}, {8, 11, 600}, {8, 12, 600}, {8, 13, 600},
            {10, 11, 1200},
            {11, 12, 600},
            {12, 13, 300}
        };
        for (int[] link : links) {
            graph.addLink(String.valueOf(link[0]), String.valueOf(link[1]), link[2]);
        }
        return graph;
    }
}
