package com.mooncell.relay.core.network;

import lombok.Getter;

import java.time.Duration;

@Getter
public class UpstreamException extends RuntimeException {

    public enum Kind {
        THROTTLED,
        TIMEOUT,
        DISCONNECTED,
        NOT_FOUND,
        ACCESS_DENIED,
        TOO_LARGE,
        TRANSIENT,
        OTHER;

        /** 可以通过整任务重新入队恢复的错误 */
        public boolean isRetryable() {
            return this == THROTTLED || this == TIMEOUT || this == DISCONNECTED;
        }

        /** 主上传路径失败后值得走备用路径的错误 */
        public boolean allowsFallback() {
            return this == TOO_LARGE || this == TRANSIENT || this == TIMEOUT || this == THROTTLED;
        }
    }

    private final Kind kind;
    private final Duration waitHint;

    public UpstreamException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public UpstreamException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private UpstreamException(Kind kind, String message, Duration waitHint, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.waitHint = waitHint;
    }

    public static UpstreamException throttled(Duration waitHint) {
        return new UpstreamException(Kind.THROTTLED, "Upstream requested a wait of " + waitHint, waitHint, null);
    }

    public static UpstreamException timeout(String operation, Duration limit) {
        return new UpstreamException(Kind.TIMEOUT, operation + " exceeded " + limit);
    }
}
