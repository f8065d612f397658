package com.mooncell.relay.core.traffic;

public enum LimitKind {
    PER_FILE,
    DAILY,
    MONTHLY
}
