package com.cyclomatic.analysis;

/**
 * Thrown when the operator of a binary node cannot be recovered from its tokens.
 */
public class OperatorResolutionException extends Exception {

    public OperatorResolutionException(String message) {
        super(message);
    }
}
