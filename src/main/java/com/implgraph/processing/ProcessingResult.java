// com/implgraph/processing/ProcessingResult.java
package com.implgraph.processing;

import java.util.ArrayList;
import java.util.List;

/**
 * Result container for one run over a rules path
 */
public class ProcessingResult {
    private int processedFiles;
    private long totalRules;
    private long totalNodes;
    private long totalEdges;
    private long reachabilityQueries;
    private long longestChainDistance;
    private String longestChainSource;

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private long processingTimeMs;

    public void addAnalysis(RuleSetAnalysis analysis) {
        processedFiles++;
        totalRules += analysis.getStats().getRuleCount();
        totalNodes += analysis.getStats().getNodeCount();
        totalEdges += analysis.getStats().getEdgeCount();
        reachabilityQueries += analysis.getReachability().size();

        int distance = analysis.getLongestChain().getDistance();
        if (distance > longestChainDistance) {
            longestChainDistance = distance;
            longestChainSource = analysis.getSource();
        }
    }

    public int getProcessedFiles() { return processedFiles; }
    public long getTotalRules() { return totalRules; }
    public long getTotalNodes() { return totalNodes; }
    public long getTotalEdges() { return totalEdges; }
    public long getReachabilityQueries() { return reachabilityQueries; }

    /** Longest chain over every file processed, 0 when none had a chain. */
    public long getLongestChainDistance() { return longestChainDistance; }

    /** Rule file holding the longest chain, null when none had a chain. */
    public String getLongestChainSource() { return longestChainSource; }

    public List<String> getErrors() {
        return new ArrayList<>(errors);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public long getProcessingTimeMs() { return processingTimeMs; }
    public void setProcessingTimeMs(long processingTimeMs) { this.processingTimeMs = processingTimeMs; }

    @Override
    public String toString() {
        return String.format("ProcessingResult{success=%s, files=%d, rules=%d, nodes=%d, edges=%d, " +
                        "queries=%d, longestChain=%d, errors=%d, warnings=%d, timeMs=%d}",
                isSuccess(), processedFiles, totalRules, totalNodes, totalEdges,
                reachabilityQueries, longestChainDistance, errors.size(), warnings.size(), processingTimeMs);
    }
}
