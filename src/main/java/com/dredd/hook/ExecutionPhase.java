package com.dredd.hook;

/**
 * Lifecycle phases that run once a rule's evaluation says it should execute, in this order.
 */
public enum ExecutionPhase {

    PRE_EXECUTE("pre-execute"),
    EXECUTE("execute"),
    POST_EXECUTE("post-execute");

    private final String displayName;

    ExecutionPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
