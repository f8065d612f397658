package com.mooncell.relay.core.model;

public enum BatchState {
    ACTIVE,
    CANCELLING,
    COMPLETED,
    CANCELLED;

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED;
    }
}
