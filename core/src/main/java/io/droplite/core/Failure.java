package io.droplite.core;

/**
 * Typed failure reasons surfaced by accumulator, ledger, submission and claim paths.
 * Terminal failures cannot be fixed by retrying with corrected input for the same key.
 */
public enum Failure {
    TREE_FULL(true),
    PROOF_INVALID(false),
    INVALID_CATEGORY(false),
    ALREADY_SUBMITTED(true),
    BATCH_TOO_LARGE(false),
    CAP_EXCEEDED(false),
    DEADLINE_EXPIRED(false),
    INVALID_SIGNATURE(false),
    NONCE_REPLAY(false),
    ROOT_MISMATCH(false),
    NO_DISTRIBUTION(false),
    ALREADY_CLAIMED(true),
    UNAUTHORIZED(false);

    private final boolean terminal;

    Failure(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean terminal() {
        return terminal;
    }
}
