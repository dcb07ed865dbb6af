// com/implgraph/graph/ImplicationGraphBuilder.java
package com.implgraph.graph;

import com.implgraph.rules.Predicate;
import com.implgraph.rules.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds an {@link ImplicationGraph} with one edge per (antecedent, consequent) pair.
 * A rule {@code A1 & A2 -> B} contributes the two independent edges A1 -> B and A2 -> B.
 */
public class ImplicationGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImplicationGraphBuilder.class);

    public ImplicationGraph build(List<Rule> rules) {
        Map<Predicate, TreeSet<Predicate>> adjacency = new TreeMap<>();

        for (Rule rule : rules) {
            Predicate consequent = rule.getConsequent();
            adjacency.computeIfAbsent(consequent, k -> new TreeSet<>());
            for (Predicate antecedent : rule.getAntecedents()) {
                adjacency.computeIfAbsent(antecedent, k -> new TreeSet<>()).add(consequent);
            }
        }

        ImplicationGraph graph = new ImplicationGraph(adjacency);
        LOGGER.debug("Built graph from {} rules: {} nodes, {} edges",
                rules.size(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Summary figures for a graph and the rules it was built from.
     */
    public GraphStats statsFor(ImplicationGraph graph, List<Rule> rules) {
        int conjunctive = (int) rules.stream().filter(Rule::isConjunctive).count();
        int selfLoops = (int) graph.getEdges().stream().filter(Edge::isSelfLoop).count();
        int roots = 0;
        int leaves = 0;
        for (Predicate node : graph.getNodes()) {
            if (graph.predecessorsOf(node).isEmpty()) roots++;
            if (graph.successorsOf(node).isEmpty()) leaves++;
        }
        return new GraphStats(graph.nodeCount(), graph.edgeCount(), rules.size(), conjunctive, selfLoops, roots, leaves);
    }
}
