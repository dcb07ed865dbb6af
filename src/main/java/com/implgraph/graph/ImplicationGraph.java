// com/implgraph/graph/ImplicationGraph.java
package com.implgraph.graph;

import com.implgraph.rules.Predicate;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable directed graph over predicates. Nodes, edges and successor sets are kept in
 * lexicographic order so that every traversal visits them in the same order.
 */
public final class ImplicationGraph {

    private final NavigableSet<Predicate> nodes;
    private final NavigableSet<Edge> edges;
    private final Map<Predicate, NavigableSet<Predicate>> successors;
    private final Map<Predicate, NavigableSet<Predicate>> predecessors;

    ImplicationGraph(Map<Predicate, ? extends SortedSet<Predicate>> adjacency) {
        TreeMap<Predicate, NavigableSet<Predicate>> out = new TreeMap<>();
        TreeMap<Predicate, NavigableSet<Predicate>> in = new TreeMap<>();
        TreeSet<Edge> edgeSet = new TreeSet<>();

        for (Predicate node : adjacency.keySet()) {
            in.put(node, new TreeSet<>());
        }
        for (Map.Entry<Predicate, ? extends SortedSet<Predicate>> entry : adjacency.entrySet()) {
            out.put(entry.getKey(), Collections.unmodifiableNavigableSet(new TreeSet<>(entry.getValue())));
            for (Predicate target : entry.getValue()) {
                edgeSet.add(new Edge(entry.getKey(), target));
                in.get(target).add(entry.getKey());
            }
        }
        in.replaceAll((node, set) -> Collections.unmodifiableNavigableSet(set));

        this.nodes = Collections.unmodifiableNavigableSet(new TreeSet<>(out.keySet()));
        this.edges = Collections.unmodifiableNavigableSet(edgeSet);
        this.successors = Collections.unmodifiableMap(out);
        this.predecessors = Collections.unmodifiableMap(in);
    }

    public NavigableSet<Predicate> getNodes() { return nodes; }
    public NavigableSet<Edge> getEdges() { return edges; }

    public boolean containsNode(Predicate predicate) {
        return successors.containsKey(predicate);
    }

    public boolean containsEdge(Predicate from, Predicate to) {
        NavigableSet<Predicate> out = successors.get(from);
        return out != null && out.contains(to);
    }

    /**
     * Direct consequents of {@code predicate}, sorted. Empty for unknown predicates.
     */
    public NavigableSet<Predicate> successorsOf(Predicate predicate) {
        return successors.getOrDefault(predicate, Collections.emptyNavigableSet());
    }

    public NavigableSet<Predicate> predecessorsOf(Predicate predicate) {
        return predecessors.getOrDefault(predicate, Collections.emptyNavigableSet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        ImplicationGraph that = (ImplicationGraph) obj;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override
    public String toString() {
        return String.format("ImplicationGraph{nodes=%d, edges=%d}", nodeCount(), edgeCount());
    }
}
