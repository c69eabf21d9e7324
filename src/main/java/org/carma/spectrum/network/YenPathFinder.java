package org.carma.spectrum.network;

import java.util.*;

/**
 * Ranked path source built on Dijkstra and Yen's loopless k-shortest-paths search.
 *
 * <pre>
 *   A[0]  = Dijkstra(origin, destination)
 *   A[k]  = cheapest of all spur deviations from A[k-1], where the spur search
 *           at node i excludes the root nodes before i and every link that an
 *           already accepted path sharing the same root leaves i by
 * </pre>
 *
 * Ties on distance are broken by hop count, then by discovery order, so the
 * ranking is deterministic for a given graph.
 */
public class YenPathFinder implements PathFinder {

    @Override
    public List<NetworkPath> findPaths(NetworkGraph graph, String origin, String destination, int k) {
        if (k <= 0 || !graph.hasNode(origin) || !graph.hasNode(destination) || origin.equals(destination)) {
            return Collections.emptyList();
        }

        List<String> first = dijkstra(graph, origin, destination, Set.of(), Set.of());
        if (first == null) {
            return Collections.emptyList();
        }

        List<List<String>> accepted = new ArrayList<>();
        accepted.add(first);
        List<List<String>> candidates = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        seen.add(first);

        while (accepted.size() < k) {
            List<String> previous = accepted.get(accepted.size() - 1);

            for (int i = 0; i < previous.size() - 1; i++) {
                String spurNode = previous.get(i);
                List<String> root = previous.subList(0, i + 1);

                Set<Integer> excludedLinks = new HashSet<>();
                for (List<String> path : accepted) {
                    if (path.size() > i + 1 && path.subList(0, i + 1).equals(root)) {
                        excludedLinks.add(graph.linkIndex(path.get(i), path.get(i + 1)));
                    }
                }
                Set<String> excludedNodes = new HashSet<>(root.subList(0, i));

                List<String> spur = dijkstra(graph, spurNode, destination, excludedNodes, excludedLinks);
                if (spur == null) continue;

                List<String> total = new ArrayList<>(root.subList(0, i));
                total.addAll(spur);
                if (seen.add(total)) {
                    candidates.add(total);
                }
            }

            if (candidates.isEmpty()) break;

            List<String> best = candidates.get(0);
            for (List<String> candidate : candidates) {
                if (compare(graph, candidate, best) < 0) {
                    best = candidate;
                }
            }
            candidates.remove(best);
            accepted.add(best);
        }

        List<NetworkPath> result = new ArrayList<>(accepted.size());
        for (List<String> nodes : accepted) {
            result.add(new NetworkPath(nodes, graph.pathDistance(nodes)));
        }
        return result;
    }

    private int compare(NetworkGraph graph, List<String> a, List<String> b) {
        int byDistance = Double.compare(graph.pathDistance(a), graph.pathDistance(b));
        if (byDistance != 0) return byDistance;
        return Integer.compare(a.size(), b.size());
    }

    // ========================================================================
    // Dijkstra
    // ========================================================================

    /**
     * Least-distance node sequence avoiding the excluded nodes and links, or null.
     */
    List<String> dijkstra(NetworkGraph graph, String source, String target,
                          Set<String> excludedNodes, Set<Integer> excludedLinks) {
        record Frontier(String node, double cost, long order) {}

        Map<String, Double> best = new HashMap<>();
        Map<String, String> previous = new HashMap<>();
        Set<String> settled = new HashSet<>();
        PriorityQueue<Frontier> queue = new PriorityQueue<>(
            Comparator.comparingDouble(Frontier::cost).thenComparingLong(Frontier::order));

        long order = 0;
        best.put(source, 0.0);
        queue.add(new Frontier(source, 0.0, order++));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (!settled.add(current.node())) continue;
            if (current.node().equals(target)) break;

            for (Link link : graph.getIncidentLinks(current.node())) {
                if (excludedLinks.contains(link.getIndex())) continue;
                String next = link.opposite(current.node());
                if (excludedNodes.contains(next) || settled.contains(next)) continue;

                double cost = current.cost() + link.getDistanceKm();
                Double known = best.get(next);
                if (known == null || cost < known) {
                    best.put(next, cost);
                    previous.put(next, current.node());
                    queue.add(new Frontier(next, cost, order++));
                }
            }
        }

        if (!settled.contains(target)) {
            return null;
        }

        LinkedList<String> path = new LinkedList<>();
        for (String node = target; node != null; node = previous.get(node)) {
            path.addFirst(node);
        }
        return path;
    }
}
