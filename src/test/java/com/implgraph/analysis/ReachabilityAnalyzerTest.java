package com.implgraph.analysis;

import com.implgraph.graph.ImplicationGraph;
import com.implgraph.rules.Predicate;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import static com.implgraph.TestRules.graph;
import static com.implgraph.TestRules.p;
import static com.implgraph.TestRules.path;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReachabilityAnalyzerTest {

    private final ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer();

    @Test
    void whenReaching_givenSimpleChain_shouldReturnShortestPathToEachConsequence() {
        ReachabilityResult result = analyzer.reachableFrom(graph("A -> B", "B -> C"), p("A"));

        assertEquals(Set.of(p("B"), p("C")), result.getReachable());
        assertEquals(path("A", "B"), result.pathTo(p("B")).orElseThrow().getPredicates());
        assertEquals(path("A", "B", "C"), result.pathTo(p("C")).orElseThrow().getPredicates());
        assertEquals(OptionalInt.of(2), result.distanceTo(p("C")));
        assertFalse(result.isReachable(p("A")));
    }

    @Test
    void whenReaching_givenConjunctiveRule_shouldTreatEachAntecedentAsSufficient() {
        ImplicationGraph graph = graph("A & X -> B", "B -> C");

        ReachabilityResult fromA = analyzer.reachableFrom(graph, p("A"));
        ReachabilityResult fromX = analyzer.reachableFrom(graph, p("X"));

        assertEquals(path("A", "B"), fromA.pathTo(p("B")).orElseThrow().getPredicates());
        assertEquals(path("A", "B", "C"), fromA.pathTo(p("C")).orElseThrow().getPredicates());
        assertEquals(path("X", "B"), fromX.pathTo(p("B")).orElseThrow().getPredicates());
        assertEquals(path("X", "B", "C"), fromX.pathTo(p("C")).orElseThrow().getPredicates());
        assertEquals(2, fromX.size());
    }

    @Test
    void whenReaching_givenUnknownStart_shouldThrowUnknownPredicate() {
        UnknownPredicateException e = assertThrows(UnknownPredicateException.class,
                () -> analyzer.reachableFrom(graph("A -> B"), p("Z")));

        assertEquals("Z", e.getLabel());
    }

    @Test
    void whenReaching_givenSink_shouldReturnEmptyResult() {
        ReachabilityResult result = analyzer.reachableFrom(graph("A -> B"), p("B"));

        assertTrue(result.isEmpty());
        assertEquals(OptionalInt.empty(), result.distanceTo(p("A")));
    }

    @Test
    void whenReaching_givenEdgesPointingAtStart_shouldNotTraverseBackwards() {
        ReachabilityResult result = analyzer.reachableFrom(graph("A -> B", "B -> C"), p("B"));

        assertEquals(Set.of(p("C")), result.getReachable());
    }

    @Test
    void whenReaching_givenSelfLoop_shouldIncludeStartAtDistanceOne() {
        ReachabilityResult result = analyzer.reachableFrom(graph("A -> A", "A -> B"), p("A"));

        assertEquals(Set.of(p("A"), p("B")), result.getReachable());
        assertEquals(path("A", "A"), result.pathTo(p("A")).orElseThrow().getPredicates());
    }

    @Test
    void whenReaching_givenCycleBackToStart_shouldIncludeStartWithShortestLoop() {
        ReachabilityResult result = analyzer.reachableFrom(
                graph("A -> B", "B -> C", "C -> A", "B -> D", "D -> E", "E -> A"), p("A"));

        assertEquals(path("A", "B", "C", "A"), result.pathTo(p("A")).orElseThrow().getPredicates());
        assertEquals(OptionalInt.of(3), result.distanceTo(p("A")));
    }

    @Test
    void whenReaching_givenEqualLengthAlternatives_shouldPreferLexicographicallySmallerRoute() {
        ReachabilityResult result = analyzer.reachableFrom(
                graph("S -> Y", "S -> X", "Y -> T", "X -> T"), p("S"));

        assertEquals(path("S", "X", "T"), result.pathTo(p("T")).orElseThrow().getPredicates());
    }

    @Test
    void whenReaching_givenShortcut_shouldReturnShortestPath() {
        ReachabilityResult result = analyzer.reachableFrom(
                graph("A -> B", "B -> C", "C -> D", "A -> D"), p("A"));

        assertEquals(path("A", "D"), result.pathTo(p("D")).orElseThrow().getPredicates());
    }

    @Test
    void whenReaching_givenBranchyGraph_shouldReturnValidMinimalPaths() {
        ImplicationGraph graph = graph(
                "a -> b", "a -> c", "b -> d", "c -> d", "d -> e", "c & f -> g",
                "g -> e", "e -> h", "h -> a", "b -> i", "i -> j", "j -> h", "f -> k");

        for (Predicate start : graph.getNodes()) {
            ReachabilityResult result = analyzer.reachableFrom(graph, start);
            Map<Predicate, Integer> expected = bfsDistances(graph, start);

            Set<Predicate> expectedReachable = new HashSet<>(expected.keySet());
            expectedReachable.remove(start);
            Set<Predicate> actualReachable = new HashSet<>(result.getReachable());
            actualReachable.remove(start);
            assertEquals(expectedReachable, actualReachable, "reachable from " + start);

            for (Map.Entry<Predicate, ImplicationPath> entry : result.getPaths().entrySet()) {
                List<Predicate> steps = entry.getValue().getPredicates();
                assertEquals(start, steps.get(0));
                assertEquals(entry.getKey(), steps.get(steps.size() - 1));
                for (int i = 0; i + 1 < steps.size(); i++) {
                    assertTrue(graph.containsEdge(steps.get(i), steps.get(i + 1)), "edge " + steps.get(i) + " -> " + steps.get(i + 1));
                }
                if (!entry.getKey().equals(start)) {
                    assertEquals(expected.get(entry.getKey()).intValue(), entry.getValue().length());
                }
            }
        }
    }

    @Test
    void whenReaching_givenRepeatedQueries_shouldReturnIdenticalPaths() {
        ImplicationGraph graph = graph("A -> C", "A -> B", "B -> D", "C -> D", "D -> E");

        assertEquals(analyzer.reachableFrom(graph, p("A")).getPaths(), analyzer.reachableFrom(graph, p("A")).getPaths());
    }

    private static Map<Predicate, Integer> bfsDistances(ImplicationGraph graph, Predicate start) {
        Map<Predicate, Integer> distances = new HashMap<>();
        Deque<Predicate> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            Predicate current = queue.poll();
            for (Predicate next : graph.successorsOf(current)) {
                if (!distances.containsKey(next)) {
                    distances.put(next, distances.get(current) + 1);
                    queue.add(next);
                }
            }
        }
        return distances;
    }
}
