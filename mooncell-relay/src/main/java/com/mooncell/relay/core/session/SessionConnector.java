package com.mooncell.relay.core.session;

import reactor.core.publisher.Mono;

/**
 * 上游会话的建立与断开，由具体的网络客户端实现。
 * connect 以 {@link SessionInvalidException} 结束表示凭证已失效，不应再重连。
 */
public interface SessionConnector {

    Mono<Void> connect(ClientHandle handle);

    Mono<Void> disconnect(ClientHandle handle);
}
