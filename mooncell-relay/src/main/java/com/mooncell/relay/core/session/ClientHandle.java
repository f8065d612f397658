package com.mooncell.relay.core.session;

import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一个已认证的上游会话。
 * 状态迁移在对象锁内串行，不同 handle 之间互不影响。
 */
@Getter
public class ClientHandle {

    private final String id;
    private final HandleKind kind;
    private final String identity;   // 特权会话为所属用户 id
    private final transient String credential;

    private volatile ConnectivityState state = ConnectivityState.DISCONNECTED;

    // --- 运行时状态 ---
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger leases = new AtomicInteger(0);
    private volatile long lastUsedTime = System.currentTimeMillis();
    private volatile long lastFailureTime = 0;
    private volatile String lastFailureReason;

    public ClientHandle(HandleKind kind, String identity, String credential) {
        this.id = UUID.randomUUID().toString();
        this.kind = kind;
        this.identity = identity;
        this.credential = credential;
    }

    public boolean isReady() {
        return state == ConnectivityState.READY;
    }

    synchronized ConnectivityState transition(ConnectivityState next) {
        ConnectivityState previous = state;
        state = next;
        return previous;
    }

    /**
     * 仅在断开或降级时才允许发起连接，防止重复连接
     */
    synchronized boolean beginConnecting() {
        if (state == ConnectivityState.READY || state == ConnectivityState.CONNECTING) {
            return false;
        }
        state = ConnectivityState.CONNECTING;
        return true;
    }

    void lease() {
        leases.incrementAndGet();
        lastUsedTime = System.currentTimeMillis();
    }

    void unlease() {
        leases.updateAndGet(v -> Math.max(0, v - 1));
        lastUsedTime = System.currentTimeMillis();
    }

    void recordSuccess() {
        failureCount.set(0);
        lastFailureReason = null;
    }

    void recordFailure(String reason) {
        failureCount.incrementAndGet();
        lastFailureTime = System.currentTimeMillis();
        lastFailureReason = reason;
    }

    public String maskedCredential() {
        if (credential == null || credential.length() <= 8) {
            return "****";
        }
        return credential.substring(0, 4) + "****" + credential.substring(credential.length() - 4);
    }

    @Override
    public String toString() {
        return kind + ":" + identity + "(" + state + ")";
    }
}
