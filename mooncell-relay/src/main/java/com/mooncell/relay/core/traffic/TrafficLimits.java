package com.mooncell.relay.core.traffic;

import com.mooncell.relay.config.RelayProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 当前生效的流量限制，单位字节。
 * 账本持有的实例只整体替换，不原地修改。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrafficLimits {

    private boolean enabled;
    private long perFileLimit;
    private long dailyLimit;
    private long monthlyLimit;

    public static TrafficLimits from(RelayProperties.Traffic traffic) {
        return new TrafficLimits(traffic.isEnabled(), traffic.getPerFileLimit(),
                traffic.getDailyLimit(), traffic.getMonthlyLimit());
    }
}
