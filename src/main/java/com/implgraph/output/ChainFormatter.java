// com/implgraph/output/ChainFormatter.java
package com.implgraph.output;

import com.implgraph.analysis.ImplicationPath;
import com.implgraph.analysis.LongestChainResult;
import com.implgraph.analysis.ReachabilityResult;
import com.implgraph.rules.Predicate;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats analysis results as terminal report lines.
 */
public final class ChainFormatter {

    private static final String RULE = "--------------------------------";
    private static final String MARGIN = "   |   ";

    private ChainFormatter() {
    }

    public static List<String> formatLongestChain(LongestChainResult result) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        if (result.getWitness().isPresent()) {
            ImplicationPath path = result.getWitness().get();
            lines.add("Longest implication chain in graph (Sorites Conclusion):");
            lines.add(MARGIN + path);
            lines.add(MARGIN + "Concludes: " + path.getSource() + " -> " + path.getTarget());
            lines.add(MARGIN + "Length: " + path.length());
        } else {
            lines.add("No implication chain in graph (" + result.getOutcome().getDisplayName() + ")");
        }
        lines.add(RULE);
        return lines;
    }

    public static List<String> formatReachability(ReachabilityResult result) {
        List<String> lines = new ArrayList<>();
        String start = result.getStart().getLabel();
        if (result.isEmpty()) {
            lines.add("No nodes are reachable from '" + start + "'.");
            return lines;
        }

        lines.add(RULE);
        lines.add("From '" + start + "', you can reach " + result.size() + " node(s):");
        for (Predicate target : result.getReachable()) {
            lines.add(MARGIN + target.getLabel());
        }
        lines.add(RULE);
        lines.add("Shortest paths from " + start + " to each reachable node:");
        for (ImplicationPath path : result.getPaths().values()) {
            lines.add(MARGIN + path);
        }
        lines.add(RULE);
        return lines;
    }
}
