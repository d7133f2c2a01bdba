package io.storvix.core.scheduler;

public enum PollerState {
    IDLE,
    SCANNING,
    EXECUTING,
    ADVANCING
}
