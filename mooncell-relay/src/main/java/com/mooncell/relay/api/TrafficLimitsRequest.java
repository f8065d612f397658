package com.mooncell.relay.api;

import com.mooncell.relay.core.traffic.TrafficLimits;
import lombok.Data;

/**
 * 部分更新：未给出的字段保持当前值。大小单位为字节
 */
@Data
public class TrafficLimitsRequest {
    private Boolean enabled;
    private Long perFileLimit;
    private Long dailyLimit;
    private Long monthlyLimit;

    public TrafficLimits applyTo(TrafficLimits current) {
        TrafficLimits.TrafficLimitsBuilder builder = current.toBuilder();
        if (enabled != null) {
            builder.enabled(enabled);
        }
        if (perFileLimit != null) {
            builder.perFileLimit(perFileLimit);
        }
        if (dailyLimit != null) {
            builder.dailyLimit(dailyLimit);
        }
        if (monthlyLimit != null) {
            builder.monthlyLimit(monthlyLimit);
        }
        return builder.build();
    }
}
