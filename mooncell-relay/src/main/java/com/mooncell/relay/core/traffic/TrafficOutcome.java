package com.mooncell.relay.core.traffic;

public enum TrafficOutcome {
    SUCCEEDED,
    FAILED
}
