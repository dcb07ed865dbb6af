// com/implgraph/processing/RuleSetAnalysis.java
package com.implgraph.processing;

import com.implgraph.analysis.LongestChainResult;
import com.implgraph.analysis.ReachabilityResult;
import com.implgraph.graph.GraphStats;
import com.implgraph.graph.ImplicationGraph;
import com.implgraph.rules.ParsedRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything computed for one rule file, handed to the report output.
 */
public class RuleSetAnalysis {
    private final ParsedRules rules;
    private final ImplicationGraph graph;
    private final GraphStats stats;
    private final LongestChainResult longestChain;
    private final Map<String, ReachabilityResult> reachability = new LinkedHashMap<>();
    private final List<String> unknownStartPredicates = new ArrayList<>();

    public RuleSetAnalysis(ParsedRules rules, ImplicationGraph graph, GraphStats stats, LongestChainResult longestChain) {
        this.rules = rules;
        this.graph = graph;
        this.stats = stats;
        this.longestChain = longestChain;
    }

    public String getSource() { return rules.getSource(); }
    public ParsedRules getRules() { return rules; }
    public ImplicationGraph getGraph() { return graph; }
    public GraphStats getStats() { return stats; }
    public LongestChainResult getLongestChain() { return longestChain; }

    /** Reachability per requested start label, in request order. */
    public Map<String, ReachabilityResult> getReachability() {
        return Collections.unmodifiableMap(reachability);
    }

    public List<String> getUnknownStartPredicates() {
        return Collections.unmodifiableList(unknownStartPredicates);
    }

    void addReachability(String startLabel, ReachabilityResult result) {
        reachability.put(startLabel, result);
    }

    void addUnknownStartPredicate(String startLabel) {
        unknownStartPredicates.add(startLabel);
    }
}
