package com.mooncell.relay.core.session;

public enum ConnectivityState {
    DISCONNECTED,
    CONNECTING,
    READY,
    DEGRADED
}
