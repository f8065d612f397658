package com.mooncell.relay.config;

import com.mooncell.relay.core.session.ClientHandle;
import com.mooncell.relay.core.session.SessionConnector;
import reactor.core.publisher.Mono;

class UnconfiguredSessionConnector implements SessionConnector {

    @Override
    public Mono<Void> connect(ClientHandle handle) {
        return Mono.error(new IllegalStateException("Session connector not configured, cannot connect " + handle));
    }

    @Override
    public Mono<Void> disconnect(ClientHandle handle) {
        return Mono.empty();
    }
}
