// com/implgraph/rules/DefaultRuleParser.java
package com.implgraph.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses {@code A [& B ...] -> C} lines. Comment lines start with {@code #}.
 */
public class DefaultRuleParser implements RuleParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRuleParser.class);
    private static final String COMMENT_MARKER = "#";

    private final ParsePolicy policy;
    private final PredicateNormalizer normalizer;

    public DefaultRuleParser() {
        this(ParsePolicy.SKIP_WITH_WARNING, new PredicateNormalizer());
    }

    public DefaultRuleParser(ParsePolicy policy, PredicateNormalizer normalizer) {
        this.policy = policy;
        this.normalizer = normalizer;
    }

    @Override
    public ParsedRules parse(String source, List<String> lines) {
        List<Rule> rules = new ArrayList<>();
        List<MalformedRuleException> skipped = new ArrayList<>();
        int ignored = 0;

        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            try {
                Optional<Rule> rule = parseLine(lines.get(i), lineNumber);
                if (rule.isPresent()) {
                    rules.add(rule.get());
                } else {
                    ignored++;
                }
            } catch (MalformedRuleException e) {
                if (policy == ParsePolicy.FAIL_FAST) {
                    throw e;
                }
                LOGGER.warn("Skipping line {} of {}: {}", lineNumber, source, e.getReason());
                skipped.add(e);
            }
        }

        LOGGER.debug("Parsed {} rules from {} ({} skipped, {} ignored)",
                rules.size(), source, skipped.size(), ignored);
        return new ParsedRules(source, rules, skipped, ignored);
    }

    @Override
    public Optional<Rule> parseLine(String line, int lineNumber) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_MARKER)) {
            return Optional.empty();
        }

        int arrow = trimmed.indexOf(Rule.IMPLIES);
        if (arrow < 0) {
            throw new MalformedRuleException(lineNumber, trimmed, "missing '" + Rule.IMPLIES + "'");
        }
        if (trimmed.indexOf(Rule.IMPLIES, arrow + Rule.IMPLIES.length()) >= 0) {
            throw new MalformedRuleException(lineNumber, trimmed, "more than one '" + Rule.IMPLIES + "'");
        }

        String left = trimmed.substring(0, arrow).trim();
        String right = trimmed.substring(arrow + Rule.IMPLIES.length()).trim();
        if (left.isEmpty()) {
            throw new MalformedRuleException(lineNumber, trimmed, "no antecedent");
        }
        if (right.isEmpty()) {
            throw new MalformedRuleException(lineNumber, trimmed, "no consequent");
        }
        if (right.contains(Rule.AND)) {
            throw new MalformedRuleException(lineNumber, trimmed, "consequent must be a single predicate");
        }

        List<Predicate> antecedents = new ArrayList<>();
        for (String part : left.split(Rule.AND)) {
            // "A & & B" keeps A and B
            if (!part.isBlank()) {
                antecedents.add(normalizer.normalize(part));
            }
        }
        if (antecedents.isEmpty()) {
            throw new MalformedRuleException(lineNumber, trimmed, "no antecedent");
        }

        return Optional.of(new Rule(antecedents, normalizer.normalize(right), lineNumber));
    }
}
