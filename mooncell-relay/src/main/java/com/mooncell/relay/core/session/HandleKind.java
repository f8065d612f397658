package com.mooncell.relay.core.session;

import com.mooncell.relay.core.model.Capability;

public enum HandleKind {
    // 机器人会话：事件处理与公开内容转发
    GENERAL,
    // 用户会话：可访问私有频道
    PRIVILEGED;

    public static HandleKind forCapability(Capability capability) {
        return capability == Capability.PRIVILEGED ? PRIVILEGED : GENERAL;
    }
}
