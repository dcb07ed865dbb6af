// com/implgraph/rules/RuleLoadingException.java
package com.implgraph.rules;

public class RuleLoadingException extends ImplicationGraphException {

    public RuleLoadingException(String message) {
        super(message);
    }

    public RuleLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
