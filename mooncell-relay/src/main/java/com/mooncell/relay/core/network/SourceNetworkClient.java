package com.mooncell.relay.core.network;

import com.mooncell.relay.core.model.SourceReference;
import com.mooncell.relay.core.session.ClientHandle;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 上游消息网络的访问抽象。失败一律以 {@link UpstreamException} 结束，
 * 其 kind 区分限流与永久失败，编排器据此决定重试还是直接失败。
 */
public interface SourceNetworkClient {

    /**
     * 获取消息内容。媒体内容写入 stagingFile，文本内容直接放在返回值中。
     */
    Mono<FetchedContent> fetch(SourceReference reference, ClientHandle handle, Path stagingFile);

    Mono<DeliveryReceipt> deliver(FetchedContent content, String target, ClientHandle handle, DeliveryPath path);
}
