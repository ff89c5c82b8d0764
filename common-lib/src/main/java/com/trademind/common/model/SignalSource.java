package com.trademind.common.model;

/** Provenance of the data a signal was computed from. */
public enum SignalSource {
    LIVE,
    DERIVED,
    SIMULATED
}
