package com.mooncell.relay.core.model;

public enum Capability {
    GENERAL,
    PRIVILEGED
}
