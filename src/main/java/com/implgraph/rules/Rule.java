// com/implgraph/rules/Rule.java
package com.implgraph.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One implication: a conjunction of antecedents implying a single consequent.
 * A rule with one antecedent is the degenerate case of the conjunctive form.
 */
public final class Rule {

    public static final String IMPLIES = "->";
    public static final String AND = "&";

    private final Set<Predicate> antecedents;
    private final Predicate consequent;
    private final int lineNumber;

    public Rule(Collection<Predicate> antecedents, Predicate consequent) {
        this(antecedents, consequent, 0);
    }

    public Rule(Collection<Predicate> antecedents, Predicate consequent, int lineNumber) {
        if (antecedents == null || antecedents.isEmpty()) {
            throw new IllegalArgumentException("A rule needs at least one antecedent");
        }
        this.antecedents = Collections.unmodifiableSet(new LinkedHashSet<>(antecedents));
        this.consequent = Objects.requireNonNull(consequent, "consequent");
        this.lineNumber = lineNumber;
    }

    /** Antecedents in the order they were written, duplicates collapsed. */
    public Set<Predicate> getAntecedents() { return antecedents; }
    public Predicate getConsequent() { return consequent; }

    /** 1-based line in the source text, or 0 when the rule was not parsed from text. */
    public int getLineNumber() { return lineNumber; }

    public boolean isConjunctive() {
        return antecedents.size() > 1;
    }

    /**
     * Render as {@code A & B -> C}. Parsing the result yields an equal rule.
     */
    public String toCanonicalString() {
        return antecedents.stream()
                .map(Predicate::getLabel)
                .collect(Collectors.joining(" " + AND + " "))
                + " " + IMPLIES + " " + consequent.getLabel();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Rule that = (Rule) obj;
        return antecedents.equals(that.antecedents) && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedents, consequent);
    }

    @Override
    public String toString() {
        return "Rule{" + toCanonicalString() + (lineNumber > 0 ? ", line=" + lineNumber : "") + '}';
    }
}
