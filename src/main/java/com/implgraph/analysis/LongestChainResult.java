// com/implgraph/analysis/LongestChainResult.java
package com.implgraph.analysis;

import java.util.Optional;

/**
 * The sorites conclusion of a rule set: the pair of predicates whose shortest implication chain is
 * the longest in the graph. Graphs without such a pair report distance 0 and no witness, with an
 * outcome that tells the two degenerate cases apart.
 */
public class LongestChainResult {

    private final ChainOutcome outcome;
    private final ImplicationPath witness;

    private LongestChainResult(ChainOutcome outcome, ImplicationPath witness) {
        this.outcome = outcome;
        this.witness = witness;
    }

    public static LongestChainResult found(ImplicationPath witness) {
        if (witness.length() < 1) {
            throw new IllegalArgumentException("A chain has at least one edge: " + witness);
        }
        return new LongestChainResult(ChainOutcome.CHAIN_FOUND, witness);
    }

    public static LongestChainResult emptyGraph() {
        return new LongestChainResult(ChainOutcome.EMPTY_GRAPH, null);
    }

    public static LongestChainResult noReachablePairs() {
        return new LongestChainResult(ChainOutcome.NO_REACHABLE_PAIRS, null);
    }

    public ChainOutcome getOutcome() { return outcome; }

    public Optional<ImplicationPath> getWitness() {
        return Optional.ofNullable(witness);
    }

    public int getDistance() {
        return witness == null ? 0 : witness.length();
    }

    public boolean hasChain() {
        return outcome == ChainOutcome.CHAIN_FOUND;
    }

    @Override
    public String toString() {
        return "LongestChainResult{outcome=" + outcome +
                ", distance=" + getDistance() +
                (witness != null ? ", path=" + witness : "") +
                '}';
    }
}
