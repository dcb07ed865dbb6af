// com/implgraph/analysis/UnknownPredicateException.java
package com.implgraph.analysis;

import com.implgraph.rules.ImplicationGraphException;
import com.implgraph.rules.Predicate;

/**
 * A query named a predicate that appears in no rule. Blank labels never name a node either.
 */
public class UnknownPredicateException extends ImplicationGraphException {

    private final String label;

    public UnknownPredicateException(Predicate predicate) {
        this(predicate.getLabel());
    }

    public UnknownPredicateException(String label) {
        super("Predicate '" + (label == null ? "" : label) + "' is not in the graph");
        this.label = label == null ? "" : label;
    }

    /** The label as queried, normalized when it named a predicate. */
    public String getLabel() { return label; }
}
