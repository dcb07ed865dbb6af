// com/implgraph/rules/PredicateNormalizer.java
package com.implgraph.rules;

import java.util.Locale;

/**
 * Turns raw labels into {@link Predicate}s. Rule text and query labels must go through the same
 * normalizer, otherwise a query may miss a node that is present in the graph.
 */
public class PredicateNormalizer {

    private final boolean foldCase;

    public PredicateNormalizer() {
        this(false);
    }

    public PredicateNormalizer(boolean foldCase) {
        this.foldCase = foldCase;
    }

    public Predicate normalize(String rawLabel) {
        if (rawLabel != null && foldCase) {
            return Predicate.of(rawLabel.toLowerCase(Locale.ROOT));
        }
        return Predicate.of(rawLabel);
    }
}
