package com.mooncell.relay.core.traffic;

import lombok.Value;

@Value
public class QuotaDecision {

    private static final QuotaDecision ALLOWED = new QuotaDecision(true, null);

    boolean allowed;
    LimitKind exceededLimit;

    public static QuotaDecision allowed() {
        return ALLOWED;
    }

    public static QuotaDecision exceeded(LimitKind kind) {
        return new QuotaDecision(false, kind);
    }
}
