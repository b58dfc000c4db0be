package com.example.styleverify.model;

/**
 * Severity of a reported mismatch. {@link #rank()} grows with importance.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }
}
