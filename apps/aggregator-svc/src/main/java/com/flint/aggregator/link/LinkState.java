package com.flint.aggregator.link;

public enum LinkState {
    IDLE,
    OPENED,
    COMPLETED,
    CANCELLED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != IDLE && this != OPENED;
    }
}
