package com.pdftranslator.backend.enums;

/**
 * Lifecycle of a translation job. Pipeline states are ordered; {@code FAILED} and {@code EXPIRED}
 * can be entered from any earlier state.
 */
public enum JobStatus {
    CREATED(0, false),
    VALIDATING(1, false),
    EXTRACTING(2, false),
    TRANSLATING(3, false),
    RECONSTRUCTING(4, false),
    COMPLETED(5, true),
    FAILED(6, true),
    EXPIRED(7, true);

    private final int rank;
    private final boolean terminal;

    JobStatus(int rank, boolean terminal) {
        this.rank = rank;
        this.terminal = terminal;
    }

    public int rank() {
        return rank;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
