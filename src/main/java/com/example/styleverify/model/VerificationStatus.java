package com.example.styleverify.model;

/**
 * Lifecycle of a verification run: {@code PENDING → RUNNING → {COMPLETED | FAILED}}.
 * Terminal states accept no further transition.
 */
public enum VerificationStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(VerificationStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
