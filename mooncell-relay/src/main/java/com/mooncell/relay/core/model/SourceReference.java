package com.mooncell.relay.core.model;

import lombok.Value;

/**
 * 已解析的消息来源：chatId 已经是上游网络可直接使用的形式
 * (公开频道为用户名，私有频道为带 -100 前缀的内部 id)
 */
@Value
public class SourceReference {
    String chatId;
    long messageId;
    ReferenceKind kind;

    public Capability requiredCapability() {
        return kind.requiredCapability();
    }

    public SourceReference withOffset(int offset) {
        return new SourceReference(chatId, messageId + offset, kind);
    }

    @Override
    public String toString() {
        return chatId + "/" + messageId;
    }
}
