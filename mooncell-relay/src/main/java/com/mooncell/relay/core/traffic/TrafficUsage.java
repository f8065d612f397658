package com.mooncell.relay.core.traffic;

import lombok.Value;

/**
 * 已结算的用量，单位字节。userId 为 null 表示所有用户合计
 */
@Value
public class TrafficUsage {
    String userId;
    long daily;
    long monthly;
    long total;
    long reserved;
}
