// com/implgraph/analysis/ReachabilityAnalyzer.java
package com.implgraph.analysis;

import com.implgraph.graph.ImplicationGraph;
import com.implgraph.rules.Predicate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Breadth-first search along implication edges. Successors are expanded in lexicographic order,
 * so among equally short paths the one discovered first through the smallest labels wins.
 */
public class ReachabilityAnalyzer {

    /**
     * Shortest implication chains from {@code start} to every predicate it implies. The start
     * itself is only part of the result when a cycle leads back to it.
     *
     * @throws UnknownPredicateException if {@code start} is not a node of the graph
     */
    public ReachabilityResult reachableFrom(ImplicationGraph graph, Predicate start) {
        if (!graph.containsNode(start)) {
            throw new UnknownPredicateException(start);
        }

        Map<Predicate, ImplicationPath> discovered = new HashMap<>();
        Deque<Predicate> queue = new ArrayDeque<>();
        ImplicationPath trivial = ImplicationPath.startingAt(start);
        ImplicationPath loopBack = null;
        queue.add(start);

        while (!queue.isEmpty()) {
            Predicate current = queue.poll();
            ImplicationPath currentPath = current.equals(start) ? trivial : discovered.get(current);

            for (Predicate next : graph.successorsOf(current)) {
                if (next.equals(start)) {
                    // nodes leave the queue in distance order, so the first loop found is the shortest
                    if (loopBack == null) {
                        loopBack = currentPath.extendTo(start);
                    }
                } else if (!discovered.containsKey(next)) {
                    discovered.put(next, currentPath.extendTo(next));
                    queue.add(next);
                }
            }
        }

        if (loopBack != null) {
            discovered.put(start, loopBack);
        }
        return new ReachabilityResult(start, discovered);
    }
}
