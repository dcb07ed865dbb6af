// com/implgraph/rules/ImplicationGraphException.java
package com.implgraph.rules;

/**
 * Base type for the recoverable problems raised while reading rules or querying a graph.
 */
public class ImplicationGraphException extends RuntimeException {

    public ImplicationGraphException(String message) {
        super(message);
    }

    public ImplicationGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
