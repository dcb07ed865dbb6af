// com/implgraph/rules/RuleParser.java
package com.implgraph.rules;

import java.util.List;
import java.util.Optional;

public interface RuleParser {
    /**
     * Parse the lines of one text source. Blank and comment lines are ignored; malformed lines
     * are handled according to the parser's {@link ParsePolicy}.
     */
    ParsedRules parse(String source, List<String> lines);

    /**
     * Parse a single line. Returns empty for blank and comment lines.
     *
     * @throws MalformedRuleException if the line is neither ignorable nor a well-formed rule
     */
    Optional<Rule> parseLine(String line, int lineNumber);
}
