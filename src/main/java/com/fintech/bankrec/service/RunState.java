package com.fintech.bankrec.service;

/**
 * States of a reconciliation run. Runs move strictly forward and end in one of the
 * terminal states.
 */
public enum RunState {
    IDLE,
    LOADING_UNMATCHED,
    MATCHING,
    RESOLVING_SPLITS,
    CLASSIFYING_DUPLICATES,
    APPLYING,
    COMMITTED(true),
    ROLLED_BACK(true),
    /**
     * Cancelled before applying; nothing was persisted.
     */
    ABORTED(true),
    /**
     * Dry run finished planning; nothing was persisted.
     */
    PREVIEWED(true);

    private final boolean terminal;

    RunState() {
        this(false);
    }

    RunState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
