package org.bloodmatch.engine.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Immutable weighted graph over named sites with shortest-path queries.
 *
 * Edges are undirected and weighted in kilometres. Distances are computed
 * with Dijkstra's algorithm over a min-priority frontier, so the graph may
 * have any number of sites and any non-negative weights.
 */
public final class DistanceGraph {
    private static final Logger log = LoggerFactory.getLogger(DistanceGraph.class);

    /**
     * Returned when either site is unknown or no path connects them.
     */
    public static final double UNREACHABLE = Double.POSITIVE_INFINITY;

    // site -> (neighbour -> km), insertion ordered for deterministic iteration
    private final Map<String, Map<String, Double>> adjacency;

    private DistanceGraph(Map<String, Map<String, Double>> adjacency) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> e : adjacency.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        this.adjacency = Collections.unmodifiableMap(copy);
    }

    public static boolean isReachable(double distance) {
        return distance != UNREACHABLE;
    }

    /**
     * Names of all configured sites, in declaration order.
     */
    public Set<String> getSites() {
        return adjacency.keySet();
    }

    public boolean containsSite(String site) {
        return site != null && adjacency.containsKey(site);
    }

    /**
     * Direct neighbours of a site with their edge weights; empty for an unknown site.
     */
    public Map<String, Double> neighbours(String site) {
        Map<String, Double> n = adjacency.get(site);
        return n == null ? Collections.emptyMap() : n;
    }

    /**
     * Shortest path length between two sites.
     *
     * @return the distance in km, 0 when {@code from} equals {@code to}, or
     *         {@link #UNREACHABLE} when a site is unknown or disconnected
     */
    public double shortestDistance(String from, String to) {
        if (!containsSite(from) || !containsSite(to)) {
            log.debug("Unknown site in distance query: {} -> {}", from, to);
            return UNREACHABLE;
        }
        if (from.equals(to)) {
            return 0.0;
        }

        Map<String, Double> best = new HashMap<>();
        Set<String> settled = new HashSet<>();
        PriorityQueue<Frontier> frontier = new PriorityQueue<>();
        best.put(from, 0.0);
        frontier.add(new Frontier(from, 0.0));

        while (!frontier.isEmpty()) {
            Frontier current = frontier.poll();
            if (!settled.add(current.site)) {
                continue;
            }
            if (current.site.equals(to)) {
                return current.distance;
            }
            for (Map.Entry<String, Double> edge : adjacency.get(current.site).entrySet()) {
                String next = edge.getKey();
                if (settled.contains(next)) {
                    continue;
                }
                double candidate = current.distance + edge.getValue();
                Double known = best.get(next);
                if (known == null || candidate < known) {
                    best.put(next, candidate);
                    frontier.add(new Frontier(next, candidate));
                }
            }
        }

        log.debug("No path between {} and {}", from, to);
        return UNREACHABLE;
    }

    @Override
    public String toString() {
        return "DistanceGraph" + adjacency;
    }

    private static final class Frontier implements Comparable<Frontier> {
        private final String site;
        private final double distance;

        Frontier(String site, double distance) {
            this.site = site;
            this.distance = distance;
        }

        @Override
        public int compareTo(Frontier other) {
            int cmp = Double.compare(distance, other.distance);
            return cmp != 0 ? cmp : site.compareTo(other.site);
        }
    }

    /**
     * Builder for DistanceGraph. Every edge is added in both directions.
     */
    public static final class Builder {
        private final Set<String> sites = new LinkedHashSet<>();
        private final Map<String, Map<String, Double>> edges = new LinkedHashMap<>();

        public Builder site(String name) {
            Objects.requireNonNull(name, "site name must not be null");
            if (name.trim().isEmpty()) {
                throw new IllegalArgumentException("site name must not be blank");
            }
            if (sites.add(name)) {
                edges.put(name, new LinkedHashMap<>());
            }
            return this;
        }

        public Builder edge(String a, String b, double km) {
            if (!sites.contains(a) || !sites.contains(b)) {
                throw new IllegalArgumentException("edge endpoints must be declared sites: " + a + " - " + b);
            }
            if (Double.isNaN(km) || Double.isInfinite(km) || km < 0) {
                throw new IllegalArgumentException("edge weight must be finite and non-negative: " + km);
            }
            if (a.equals(b)) {
                if (km != 0) {
                    throw new IllegalArgumentException("self distance must be 0 for " + a);
                }
                return this;
            }
            edges.get(a).put(b, km);
            edges.get(b).put(a, km);
            return this;
        }

        public DistanceGraph build() {
            DistanceGraph graph = new DistanceGraph(edges);
            log.info("Distance graph built: {} sites", sites.size());
            return graph;
        }
    }
}
