// com/implgraph/graph/GraphStats.java
package com.implgraph.graph;

/**
 * Statistics about an implication graph
 */
public class GraphStats {
    private final int nodeCount;
    private final int edgeCount;
    private final int ruleCount;
    private final int conjunctiveRuleCount;
    private final int selfLoopCount;
    private final int rootCount;
    private final int leafCount;

    public GraphStats(int nodeCount, int edgeCount, int ruleCount, int conjunctiveRuleCount,
                      int selfLoopCount, int rootCount, int leafCount) {
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.ruleCount = ruleCount;
        this.conjunctiveRuleCount = conjunctiveRuleCount;
        this.selfLoopCount = selfLoopCount;
        this.rootCount = rootCount;
        this.leafCount = leafCount;
    }

    public int getNodeCount() { return nodeCount; }
    public int getEdgeCount() { return edgeCount; }
    public int getRuleCount() { return ruleCount; }
    public int getConjunctiveRuleCount() { return conjunctiveRuleCount; }
    public int getSelfLoopCount() { return selfLoopCount; }

    /** Predicates no rule concludes. */
    public int getRootCount() { return rootCount; }

    /** Predicates that imply nothing further. */
    public int getLeafCount() { return leafCount; }

    @Override
    public String toString() {
        return String.format("GraphStats{nodes=%d, edges=%d, rules=%d, conjunctive=%d, selfLoops=%d, roots=%d, leaves=%d}",
                nodeCount, edgeCount, ruleCount, conjunctiveRuleCount, selfLoopCount, rootCount, leafCount);
    }
}
