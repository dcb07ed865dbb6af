// com/implgraph/rules/ParsedRules.java
package com.implgraph.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rules read from one text source, in input order, plus the lines that were skipped as malformed.
 */
public class ParsedRules {

    private final String source;
    private final List<Rule> rules;
    private final List<MalformedRuleException> skipped;
    private final int ignoredLines;

    public ParsedRules(String source, List<Rule> rules, List<MalformedRuleException> skipped, int ignoredLines) {
        this.source = source;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
        this.ignoredLines = ignoredLines;
    }

    public String getSource() { return source; }
    public List<Rule> getRules() { return rules; }
    public List<MalformedRuleException> getSkipped() { return skipped; }

    /** Blank and comment lines. */
    public int getIgnoredLines() { return ignoredLines; }

    public boolean hasWarnings() {
        return !skipped.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return String.format("ParsedRules{source=%s, rules=%d, skipped=%d, ignored=%d}",
                source, rules.size(), skipped.size(), ignoredLines);
    }
}
