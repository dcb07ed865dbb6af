// com/implgraph/analysis/ImplicationPath.java
package com.implgraph.analysis;

import com.implgraph.rules.Predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A chain of rule applications: consecutive predicates are joined by an edge of the graph.
 */
public final class ImplicationPath {

    private final List<Predicate> predicates;

    public ImplicationPath(List<Predicate> predicates) {
        if (predicates == null || predicates.isEmpty()) {
            throw new IllegalArgumentException("A path has at least one predicate");
        }
        this.predicates = Collections.unmodifiableList(new ArrayList<>(predicates));
    }

    public static ImplicationPath startingAt(Predicate start) {
        return new ImplicationPath(List.of(start));
    }

    /** A new path with {@code next} appended. */
    public ImplicationPath extendTo(Predicate next) {
        List<Predicate> extended = new ArrayList<>(predicates.size() + 1);
        extended.addAll(predicates);
        extended.add(next);
        return new ImplicationPath(extended);
    }

    public List<Predicate> getPredicates() { return predicates; }

    public Predicate getSource() {
        return predicates.get(0);
    }

    public Predicate getTarget() {
        return predicates.get(predicates.size() - 1);
    }

    /** Number of edges. */
    public int length() {
        return predicates.size() - 1;
    }

    public List<String> labels() {
        return predicates.stream().map(Predicate::getLabel).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return predicates.equals(((ImplicationPath) obj).predicates);
    }

    @Override
    public int hashCode() {
        return predicates.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" -> ", labels());
    }
}
