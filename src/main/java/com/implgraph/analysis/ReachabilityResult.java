// com/implgraph/analysis/ReachabilityResult.java
package com.implgraph.analysis;

import com.implgraph.rules.Predicate;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Everything a start predicate implies, with the shortest chain to each consequence.
 */
public class ReachabilityResult {

    private final Predicate start;
    private final NavigableMap<Predicate, ImplicationPath> paths;

    public ReachabilityResult(Predicate start, Map<Predicate, ImplicationPath> paths) {
        this.start = start;
        this.paths = Collections.unmodifiableNavigableMap(new TreeMap<>(paths));
    }

    public Predicate getStart() { return start; }

    /** Shortest path per reachable predicate, keyed in lexicographic order. */
    public NavigableMap<Predicate, ImplicationPath> getPaths() { return paths; }

    public NavigableSet<Predicate> getReachable() {
        return paths.navigableKeySet();
    }

    public boolean isReachable(Predicate target) {
        return paths.containsKey(target);
    }

    public Optional<ImplicationPath> pathTo(Predicate target) {
        return Optional.ofNullable(paths.get(target));
    }

    public OptionalInt distanceTo(Predicate target) {
        ImplicationPath path = paths.get(target);
        return path == null ? OptionalInt.empty() : OptionalInt.of(path.length());
    }

    /** True when the start predicate implies nothing. */
    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public int size() {
        return paths.size();
    }

    @Override
    public String toString() {
        return "ReachabilityResult{start=" + start + ", reachable=" + paths.keySet() + '}';
    }
}
