// com/implgraph/analysis/ChainOutcome.java
package com.implgraph.analysis;

/**
 * How a longest-chain search ended.
 */
public enum ChainOutcome {
    CHAIN_FOUND("Chain found"),
    EMPTY_GRAPH("Empty graph"),
    NO_REACHABLE_PAIRS("No reachable pairs");

    private final String displayName;

    ChainOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
