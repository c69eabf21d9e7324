package org.carma.spectrum.network;

import java.util.List;
import java.util.Optional;

/**
 * Source of ranked candidate paths between two nodes.
 *
 * Allocators only consume the ordered output; how the ranking is computed is
 * up to the implementation.
 */
public interface PathFinder {

    /**
     * Up to {@code k} loop-free paths ordered by ascending distance.
     * Returns an empty list if the nodes are unknown or disconnected.
     */
    List<NetworkPath> findPaths(NetworkGraph graph, String origin, String destination, int k);

    /**
     * The least-distance path, if any.
     */
    default Optional<NetworkPath> shortestPath(NetworkGraph graph, String origin, String destination) {
        List<NetworkPath> paths = findPaths(graph, origin, destination, 1);
        return paths.isEmpty() ? Optional.empty() : Optional.of(paths.get(0));
    }
}
