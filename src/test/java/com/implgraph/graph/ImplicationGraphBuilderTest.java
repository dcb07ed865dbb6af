package com.implgraph.graph;

import com.implgraph.rules.Rule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.implgraph.TestRules.graph;
import static com.implgraph.TestRules.p;
import static com.implgraph.TestRules.rules;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImplicationGraphBuilderTest {

    private final ImplicationGraphBuilder builder = new ImplicationGraphBuilder();

    @Test
    void whenBuilding_givenConjunctiveRule_shouldAddOneEdgePerAntecedent() {
        ImplicationGraph graph = graph("A & X -> B", "B -> C");

        assertEquals(Set.of(p("A"), p("B"), p("C"), p("X")), graph.getNodes());
        assertEquals(Set.of(new Edge(p("A"), p("B")), new Edge(p("X"), p("B")), new Edge(p("B"), p("C"))),
                graph.getEdges());
        assertTrue(graph.containsEdge(p("X"), p("B")));
        assertFalse(graph.containsEdge(p("B"), p("A")));
    }

    @Test
    void whenBuilding_givenDuplicateRules_shouldNotCreateParallelEdges() {
        ImplicationGraph graph = graph("A -> B", "A -> B", "A & C -> B");

        assertEquals(2, graph.edgeCount());
        assertEquals(Set.of(p("B")), graph.successorsOf(p("A")));
    }

    @Test
    void whenBuilding_givenSameRulesTwice_shouldProduceEqualGraphs() {
        List<Rule> rules = rules("A -> B", "B & D -> C", "C -> A");

        ImplicationGraph first = builder.build(rules);
        ImplicationGraph second = builder.build(rules);

        assertEquals(first.getNodes(), second.getNodes());
        assertEquals(first.getEdges(), second.getEdges());
        assertEquals(first, second);
    }

    @Test
    void whenBuilding_givenShuffledRules_shouldProduceEqualGraphs() {
        List<Rule> rules = rules("A -> B", "B -> C", "C & E -> D", "E -> F", "F -> D", "D -> G");
        List<Rule> shuffled = new ArrayList<>(rules);
        Collections.shuffle(shuffled, new Random(42));

        assertEquals(builder.build(rules), builder.build(shuffled));
    }

    @Test
    void whenBuilding_givenSelfLoop_shouldKeepIt() {
        ImplicationGraph graph = graph("A -> A", "A -> B");

        assertTrue(graph.containsEdge(p("A"), p("A")));
        assertEquals(1, builder.statsFor(graph, rules("A -> A", "A -> B")).getSelfLoopCount());
    }

    @Test
    void whenBuilding_givenNoRules_shouldProduceEmptyGraph() {
        ImplicationGraph graph = builder.build(List.of());

        assertTrue(graph.isEmpty());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenQuerying_givenUnknownPredicate_shouldReturnNoNeighbours() {
        ImplicationGraph graph = graph("A -> B");

        assertTrue(graph.successorsOf(p("Z")).isEmpty());
        assertTrue(graph.predecessorsOf(p("Z")).isEmpty());
        assertEquals(Set.of(p("A")), graph.predecessorsOf(p("B")));
    }

    @Test
    void whenExposingNodes_givenBuiltGraph_shouldBeUnmodifiable() {
        ImplicationGraph graph = graph("A -> B");

        assertThrows(UnsupportedOperationException.class, () -> graph.getNodes().add(p("C")));
        assertThrows(UnsupportedOperationException.class, () -> graph.successorsOf(p("A")).add(p("C")));
    }

    @Test
    void whenComputingStats_givenMixedRules_shouldCountEachFigure() {
        List<Rule> rules = rules("A & X -> B", "B -> C", "C -> C");
        GraphStats stats = builder.statsFor(builder.build(rules), rules);

        assertEquals(4, stats.getNodeCount());
        assertEquals(4, stats.getEdgeCount());
        assertEquals(3, stats.getRuleCount());
        assertEquals(1, stats.getConjunctiveRuleCount());
        assertEquals(1, stats.getSelfLoopCount());
        assertEquals(2, stats.getRootCount());
        assertEquals(0, stats.getLeafCount());
    }
}
