package com.mooncell.relay.core.network;

public enum DeliveryPath {
    // 常规上传
    PRIMARY,
    // 主路径因文件过大或临时错误失败后的备用上传方式
    FALLBACK
}
