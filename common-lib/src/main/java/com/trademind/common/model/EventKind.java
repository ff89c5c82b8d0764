package com.trademind.common.model;

public enum EventKind {
    SIGNAL(0.4),
    DECISION(0.7),
    OUTCOME(0.9);

    private final double baseImportance;

    EventKind(double baseImportance) {
        this.baseImportance = baseImportance;
    }

    /** Kind component of the importance score, before weighting. */
    public double baseImportance() {
        return baseImportance;
    }
}
