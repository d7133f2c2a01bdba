package io.storvix.core.schedule;

public enum AdvanceOutcome {
    ADVANCED,
    COMPLETED,
    DELETED,
    MISSING
}
