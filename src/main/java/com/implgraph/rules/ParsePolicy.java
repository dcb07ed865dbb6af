// com/implgraph/rules/ParsePolicy.java
package com.implgraph.rules;

/**
 * What the parser does with a malformed rule line.
 */
public enum ParsePolicy {
    SKIP_WITH_WARNING("Skip and warn"),
    FAIL_FAST("Fail fast");

    private final String displayName;

    ParsePolicy(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
