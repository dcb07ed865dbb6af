// com/implgraph/analysis/LongestChainFinder.java
package com.implgraph.analysis;

import com.implgraph.graph.ImplicationGraph;
import com.implgraph.rules.ImplicationGraphException;
import com.implgraph.rules.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Finds the longest shortest path over all ordered pairs of distinct predicates by running one
 * breadth-first search per source. Cost is O(V * (V + E)).
 */
public class LongestChainFinder {

    private static final Logger LOGGER = LoggerFactory.getLogger(LongestChainFinder.class);

    /** Longer first, then smallest (source, target). */
    static final Comparator<ImplicationPath> PREFERRED = Comparator
            .comparingInt(ImplicationPath::length).reversed()
            .thenComparing(ImplicationPath::getSource)
            .thenComparing(ImplicationPath::getTarget);

    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final int threadPoolSize;

    public LongestChainFinder(ReachabilityAnalyzer reachabilityAnalyzer) {
        this(reachabilityAnalyzer, 1);
    }

    /**
     * @param threadPoolSize number of workers for the per-source searches; 1 runs them on the calling thread
     */
    public LongestChainFinder(ReachabilityAnalyzer reachabilityAnalyzer, int threadPoolSize) {
        if (threadPoolSize < 1) {
            throw new IllegalArgumentException("Thread pool size must be at least 1, got " + threadPoolSize);
        }
        this.reachabilityAnalyzer = reachabilityAnalyzer;
        this.threadPoolSize = threadPoolSize;
    }

    public LongestChainResult longestShortestPath(ImplicationGraph graph) {
        if (graph.isEmpty()) {
            return LongestChainResult.emptyGraph();
        }

        List<ImplicationPath> candidates = threadPoolSize > 1 && graph.nodeCount() > 1
                ? searchInParallel(graph)
                : searchSequentially(graph);

        ImplicationPath best = null;
        for (ImplicationPath candidate : candidates) {
            if (candidate != null && (best == null || PREFERRED.compare(candidate, best) < 0)) {
                best = candidate;
            }
        }

        if (best == null) {
            LOGGER.debug("No predicate in {} reaches another predicate", graph);
            return LongestChainResult.noReachablePairs();
        }
        return LongestChainResult.found(best);
    }

    /**
     * The preferred chain starting at {@code source}, or null when it reaches no other predicate.
     */
    ImplicationPath longestFrom(ImplicationGraph graph, Predicate source) {
        ImplicationPath best = null;
        for (Map.Entry<Predicate, ImplicationPath> entry : reachabilityAnalyzer.reachableFrom(graph, source).getPaths().entrySet()) {
            if (entry.getKey().equals(source)) {
                continue;
            }
            ImplicationPath path = entry.getValue();
            if (best == null || PREFERRED.compare(path, best) < 0) {
                best = path;
            }
        }
        return best;
    }

    private List<ImplicationPath> searchSequentially(ImplicationGraph graph) {
        List<ImplicationPath> candidates = new ArrayList<>(graph.nodeCount());
        for (Predicate source : graph.getNodes()) {
            candidates.add(longestFrom(graph, source));
        }
        return candidates;
    }

    private List<ImplicationPath> searchInParallel(ImplicationGraph graph) {
        int workers = Math.min(threadPoolSize, graph.nodeCount());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        LOGGER.debug("Searching {} sources with {} workers", graph.nodeCount(), workers);

        try {
            List<Future<ImplicationPath>> futures = new ArrayList<>(graph.nodeCount());
            for (Predicate source : graph.getNodes()) {
                futures.add(executor.submit(() -> longestFrom(graph, source)));
            }

            List<ImplicationPath> candidates = new ArrayList<>(futures.size());
            for (Future<ImplicationPath> future : futures) {
                candidates.add(future.get());
            }
            return candidates;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImplicationGraphException("Interrupted while searching for the longest chain", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ImplicationGraphException("Longest chain search failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
