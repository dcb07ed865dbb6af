// com/implgraph/rules/Predicate.java
package com.implgraph.rules;

import java.util.Objects;

/**
 * A proposition label. Two predicates are the same node when their normalized labels are equal.
 */
public final class Predicate implements Comparable<Predicate> {

    private final String label;

    private Predicate(String label) {
        this.label = label;
    }

    /**
     * Create a predicate from raw text, trimming it and collapsing internal whitespace runs.
     */
    public static Predicate of(String rawLabel) {
        if (rawLabel == null) {
            throw new IllegalArgumentException("Predicate label must not be null");
        }
        String normalized = rawLabel.trim().replaceAll("\\s+", " ");
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Predicate label must not be blank");
        }
        return new Predicate(normalized);
    }

    public String getLabel() { return label; }

    @Override
    public int compareTo(Predicate other) {
        return label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return label.equals(((Predicate) obj).label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label);
    }

    @Override
    public String toString() {
        return label;
    }
}
