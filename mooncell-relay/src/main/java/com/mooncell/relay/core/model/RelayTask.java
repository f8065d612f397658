package com.mooncell.relay.core.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * 一次转发任务。状态只允许 PENDING -> RUNNING -> {SUCCEEDED, FAILED}，
 * 以及重新入队时的 RUNNING -> PENDING；终态不可再变。
 * 所有状态迁移都在对象锁内做 CAS，worker 与取消方不会同时生效。
 */
@Getter
public class RelayTask {

    private final String id;
    private final String link;
    private final String requester;
    private final String jobId;   // 单条请求为 null
    private final int refIndex;   // 在批量任务中的位置，单条请求为 -1
    private final Instant createdAt;

    @Setter
    private volatile SourceReference reference;
    @Setter
    private volatile long byteSize = -1;

    private volatile TaskState state = TaskState.PENDING;
    private volatile FailureReason failureReason;
    private volatile String failureDetail;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile boolean cancelRequested;

    private int attempts;
    private int deferrals;

    private RelayTask(String requester, String link, String jobId, int refIndex) {
        this.id = UUID.randomUUID().toString();
        this.requester = requester;
        this.link = link;
        this.jobId = jobId;
        this.refIndex = refIndex;
        this.createdAt = Instant.now();
    }

    public static RelayTask single(String requester, String link) {
        return new RelayTask(requester, link, null, -1);
    }

    public static RelayTask forBatch(String jobId, int refIndex, String owner, String link) {
        return new RelayTask(owner, link, jobId, refIndex);
    }

    public Capability getRequiredCapability() {
        SourceReference ref = reference;
        return ref == null ? null : ref.requiredCapability();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean belongsToBatch() {
        return jobId != null;
    }

    public synchronized boolean markRunning() {
        if (state != TaskState.PENDING) {
            return false;
        }
        state = TaskState.RUNNING;
        startedAt = Instant.now();
        return true;
    }

    public synchronized boolean backToPending() {
        if (state != TaskState.RUNNING) {
            return false;
        }
        state = TaskState.PENDING;
        return true;
    }

    public synchronized boolean succeed(long size) {
        if (state != TaskState.RUNNING) {
            return false;
        }
        byteSize = size;
        state = TaskState.SUCCEEDED;
        finishedAt = Instant.now();
        return true;
    }

    public synchronized boolean fail(FailureReason reason, String detail) {
        if (state.isTerminal()) {
            return false;
        }
        failureReason = reason;
        failureDetail = detail;
        state = TaskState.FAILED;
        finishedAt = Instant.now();
        return true;
    }

    /**
     * 仅对尚未开始的任务生效，已在运行的任务需要走协作式取消
     */
    public synchronized boolean cancelIfPending() {
        if (state != TaskState.PENDING) {
            return false;
        }
        failureReason = FailureReason.CANCELLED;
        failureDetail = "Cancelled before start";
        state = TaskState.FAILED;
        finishedAt = Instant.now();
        return true;
    }

    public void requestCancel() {
        this.cancelRequested = true;
    }

    public synchronized int incrementAttempts() {
        return ++attempts;
    }

    public synchronized int incrementDeferrals() {
        return ++deferrals;
    }

    @Override
    public String toString() {
        return "RelayTask{" + id + ", " + link + ", " + state + "}";
    }
}
