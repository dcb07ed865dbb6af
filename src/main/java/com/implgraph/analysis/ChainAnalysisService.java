// com/implgraph/analysis/ChainAnalysisService.java
package com.implgraph.analysis;

import com.implgraph.graph.ImplicationGraph;

/**
 * Read-only queries a presentation layer runs against a built graph.
 */
public interface ChainAnalysisService {
    /**
     * Everything {@code startLabel} implies. The label is normalized the same way rule text is.
     *
     * @throws UnknownPredicateException if no rule mentions the predicate, or the label is blank
     */
    ReachabilityResult reachableFrom(ImplicationGraph graph, String startLabel);

    /**
     * The sorites conclusion: the longest shortest chain in the graph.
     */
    LongestChainResult longestChain(ImplicationGraph graph);
}
