package com.mooncell.relay.config;

import com.mooncell.relay.core.model.SourceReference;
import com.mooncell.relay.core.network.DeliveryPath;
import com.mooncell.relay.core.network.DeliveryReceipt;
import com.mooncell.relay.core.network.FetchedContent;
import com.mooncell.relay.core.network.SourceNetworkClient;
import com.mooncell.relay.core.network.UpstreamException;
import com.mooncell.relay.core.session.ClientHandle;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 未接入上游网络时的占位实现，所有调用直接失败
 */
class UnconfiguredNetworkClient implements SourceNetworkClient {

    static final String MESSAGE = "Source network client not configured";

    @Override
    public Mono<FetchedContent> fetch(SourceReference reference, ClientHandle handle, Path stagingFile) {
        return Mono.error(new UpstreamException(UpstreamException.Kind.OTHER, MESSAGE));
    }

    @Override
    public Mono<DeliveryReceipt> deliver(FetchedContent content, String target, ClientHandle handle, DeliveryPath path) {
        return Mono.error(new UpstreamException(UpstreamException.Kind.OTHER, MESSAGE));
    }
}
