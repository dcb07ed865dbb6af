// com/implgraph/analysis/BreadthFirstChainAnalysisService.java
package com.implgraph.analysis;

import com.implgraph.graph.ImplicationGraph;
import com.implgraph.rules.PredicateNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BreadthFirstChainAnalysisService implements ChainAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BreadthFirstChainAnalysisService.class);

    private final PredicateNormalizer normalizer;
    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final LongestChainFinder longestChainFinder;

    public BreadthFirstChainAnalysisService(PredicateNormalizer normalizer, int threadPoolSize) {
        this.normalizer = normalizer;
        this.reachabilityAnalyzer = new ReachabilityAnalyzer();
        this.longestChainFinder = new LongestChainFinder(reachabilityAnalyzer, threadPoolSize);
        LOGGER.info("Chain analysis service initialized with {} worker(s)", threadPoolSize);
    }

    @Override
    public ReachabilityResult reachableFrom(ImplicationGraph graph, String startLabel) {
        if (startLabel == null || startLabel.isBlank()) {
            throw new UnknownPredicateException(startLabel);
        }
        ReachabilityResult result = reachabilityAnalyzer.reachableFrom(graph, normalizer.normalize(startLabel));
        LOGGER.debug("{} reaches {} predicate(s)", result.getStart(), result.size());
        return result;
    }

    @Override
    public LongestChainResult longestChain(ImplicationGraph graph) {
        LongestChainResult result = longestChainFinder.longestShortestPath(graph);
        LOGGER.debug("Longest chain in {}: {}", graph, result);
        return result;
    }
}
