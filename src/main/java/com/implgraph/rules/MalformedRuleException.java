// com/implgraph/rules/MalformedRuleException.java
package com.implgraph.rules;

/**
 * A non-ignored line that is not of the form {@code A [& B ...] -> C}.
 */
public class MalformedRuleException extends ImplicationGraphException {

    private final int lineNumber;
    private final String line;
    private final String reason;

    public MalformedRuleException(int lineNumber, String line, String reason) {
        super(String.format("Malformed rule on line %d (%s): '%s'", lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }

    public int getLineNumber() { return lineNumber; }
    public String getLine() { return line; }
    public String getReason() { return reason; }
}
