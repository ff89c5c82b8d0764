package com.trademind.common.model;

public enum RiskVerdict {
    APPROVED,
    REJECTED,
    DEFERRED
}
