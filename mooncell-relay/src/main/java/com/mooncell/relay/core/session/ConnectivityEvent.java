package com.mooncell.relay.core.session;

import lombok.Value;

import java.time.Instant;

@Value
public class ConnectivityEvent {
    String handleId;
    HandleKind kind;
    String identity;
    ConnectivityState from;
    ConnectivityState to;
    String reason;
    Instant at;
}
