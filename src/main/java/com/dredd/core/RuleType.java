package com.dredd.core;

/**
 * Traversal strategy of a rule and of the batch its children are run in.
 */
public enum RuleType {

    /**
     * Strict single-child linear sequence. Every fired rule lets the walk continue.
     */
    CHAIN("ChainRule"),

    /**
     * Ordered multi-child search. The first sibling that executes ends the search.
     */
    BEST_FIRST("BestFirstRule");

    private final String displayName;

    RuleType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
