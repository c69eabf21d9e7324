package org.carma.spectrum.network;

import java.util.*;

/**
 * Undirected weighted network graph.
 *
 * Links keep their insertion order, which fixes the integer index the
 * spectrum ledger assigns to each of them. A link is found from either
 * traversal direction.
 */
public class NetworkGraph {

    private final Set<String> nodes;
    private final List<Link> links;
    private final Map<List<String>, Link> linksByEndpoints;
    private final Map<String, List<Link>> adjacency;

    public NetworkGraph() {
        this.nodes = new LinkedHashSet<>();
        this.links = new ArrayList<>();
        this.linksByEndpoints = new HashMap<>();
        this.adjacency = new LinkedHashMap<>();
    }

    // ========================================================================
    // Construction
    // ========================================================================

    public NetworkGraph addNode(String node) {
        if (node == null || node.isBlank()) {
            throw new IllegalArgumentException("Node identifier cannot be empty");
        }
        if (nodes.add(node)) {
            adjacency.put(node, new ArrayList<>());
        }
        return this;
    }

    /**
     * Add an undirected link, creating missing endpoints.
     * @throws IllegalArgumentException on self loops, duplicates or non-positive distance
     */
    public NetworkGraph addLink(String u, String v, double distanceKm) {
        if (Objects.equals(u, v)) {
            throw new IllegalArgumentException("Self loop not allowed at node " + u);
        }
        if (!(distanceKm > 0) || Double.isInfinite(distanceKm)) {
            throw new IllegalArgumentException(
                "Link " + u + "-" + v + " needs a positive finite distance, got " + distanceKm);
        }
        List<String> key = key(u, v);
        if (linksByEndpoints.containsKey(key)) {
            throw new IllegalArgumentException("Duplicate link " + u + "-" + v);
        }
        addNode(u);
        addNode(v);

        Link link = new Link(links.size(), u, v, distanceKm);
        links.add(link);
        linksByEndpoints.put(key, link);
        adjacency.get(u).add(link);
        adjacency.get(v).add(link);
        return this;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public boolean hasNode(String node) {
        return nodes.contains(node);
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    /**
     * Links in insertion order; position equals {@link Link#getIndex()}.
     */
    public List<Link> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getLinkCount() {
        return links.size();
    }

    public Optional<Link> getLink(String u, String v) {
        return Optional.ofNullable(linksByEndpoints.get(key(u, v)));
    }

    /**
     * Index of the link joining two nodes in either direction, or -1.
     */
    public int linkIndex(String u, String v) {
        Link link = linksByEndpoints.get(key(u, v));
        return link != null ? link.getIndex() : -1;
    }

    public List<Link> getIncidentLinks(String node) {
        return Collections.unmodifiableList(adjacency.getOrDefault(node, Collections.emptyList()));
    }

    /**
     * Total distance along a node sequence, or infinity if a hop is not a link.
     */
    public double pathDistance(List<String> pathNodes) {
        double total = 0;
        for (int i = 0; i + 1 < pathNodes.size(); i++) {
            Link link = linksByEndpoints.get(key(pathNodes.get(i), pathNodes.get(i + 1)));
            if (link == null) {
                return Double.POSITIVE_INFINITY;
            }
            total += link.getDistanceKm();
        }
        return total;
    }

    public double getAverageDegree() {
        if (nodes.isEmpty()) return 0.0;
        return 2.0 * links.size() / nodes.size();
    }

    private static List<String> key(String u, String v) {
        if (u == null || v == null) {
            return List.of();
        }
        return u.compareTo(v) <= 0 ? List.of(u, v) : List.of(v, u);
    }

    @Override
    public String toString() {
        return String.format("NetworkGraph[%d nodes, %d links]", nodes.size(), links.size());
    }
}
