package com.mooncell.relay.core.ratelimit;

import lombok.Value;

@Value
public class RateLimiterSnapshot {
    double capacity;
    double tokens;
    double rate;
    double minRate;
    double maxRate;
    int consecutiveSuccesses;
}
