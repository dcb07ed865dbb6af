// com/implgraph/graph/Edge.java
package com.implgraph.graph;

import com.implgraph.rules.Predicate;

import java.util.Comparator;
import java.util.Objects;

/**
 * A directed "implies" edge from one antecedent to a consequent.
 */
public final class Edge implements Comparable<Edge> {

    private static final Comparator<Edge> ORDER = Comparator
            .comparing(Edge::getFrom)
            .thenComparing(Edge::getTo);

    private final Predicate from;
    private final Predicate to;

    public Edge(Predicate from, Predicate to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public Predicate getFrom() { return from; }
    public Predicate getTo() { return to; }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Edge that = (Edge) obj;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
