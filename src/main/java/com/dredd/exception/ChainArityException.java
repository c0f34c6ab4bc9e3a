package com.dredd.exception;

/**
 * Exception thrown when a chain rule would own more than one child,
 * or a chain run is given more than one root rule.
 */
public class ChainArityException extends RuleException {

    public ChainArityException(String message) {
        super(message);
    }

    public static ChainArityException multipleChildren() {
        return new ChainArityException("chain rule can only have one child");
    }

    public static ChainArityException multipleRoots(int count) {
        return new ChainArityException("chain rule runner only supports one rule, got " + count);
    }
}
