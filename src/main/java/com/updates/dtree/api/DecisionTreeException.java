package com.updates.dtree.api;

/**
 * Base class for failures raised by the decision tree engine.
 */
public class DecisionTreeException extends RuntimeException {

    public DecisionTreeException(String message) {
        super(message);
    }

    public DecisionTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
