package com.mooncell.relay.core.traffic;

import java.util.Locale;

public enum TrafficResetScope {
    /** 今日用量 */
    DAILY,
    /** 本月用量 */
    MONTHLY,
    /** 全部历史用量 */
    ALL;

    public static TrafficResetScope parse(String value) {
        if (value != null) {
            for (TrafficResetScope scope : values()) {
                if (scope.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return scope;
                }
            }
        }
        throw new IllegalArgumentException("Unknown reset scope '" + value + "', expected daily, monthly or all");
    }
}
