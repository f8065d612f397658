package com.mooncell.relay.core.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 批量任务。非线程安全，由 BatchController 持有并在对象锁内修改。
 * cursor 指向下一个尚未提交的引用，只增不减。
 */
@Getter
public class BatchJob {

    private final String id;
    private final String owner;
    private final List<String> references;
    private final Instant createdAt;

    private int cursor;
    private int succeeded;
    private int failed;
    private BatchState state;
    private Instant updatedAt;

    // 仅内存态：已提交未结束的任务，恢复时需要重新提交的下标，
    // 以及游标之后已有终态记录、推进游标时要跳过的下标
    @Getter(AccessLevel.NONE)
    private final Set<String> inFlight = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final Deque<Integer> resubmits = new ArrayDeque<>();
    @Getter(AccessLevel.NONE)
    private final Set<Integer> settledAhead = new HashSet<>();

    public BatchJob(String owner, List<String> references) {
        this(UUID.randomUUID().toString(), owner, references, 0, 0, 0, BatchState.ACTIVE, Instant.now());
    }

    public BatchJob(String id, String owner, List<String> references, int cursor, int succeeded, int failed,
                    BatchState state, Instant createdAt) {
        this.id = id;
        this.owner = owner;
        this.references = List.copyOf(references);
        this.cursor = cursor;
        this.succeeded = succeeded;
        this.failed = failed;
        this.state = state;
        this.createdAt = createdAt;
        this.updatedAt = Instant.now();
    }

    public int total() {
        return references.size();
    }

    public int resolved() {
        return succeeded + failed;
    }

    public boolean hasUnsubmitted() {
        return cursor < references.size();
    }

    /** 取出下一个待提交的下标，优先恢复队列 */
    public int nextIndex() {
        if (!resubmits.isEmpty()) {
            return resubmits.peekFirst();
        }
        return cursor;
    }

    public boolean hasNext() {
        return !resubmits.isEmpty() || hasUnsubmitted();
    }

    public void markSubmitted(int index, String taskId) {
        if (!resubmits.isEmpty() && resubmits.peekFirst() == index) {
            resubmits.pollFirst();
        } else if (index == cursor) {
            cursor++;
            skipSettled();
        } else {
            throw new IllegalStateException("Index " + index + " is not next for job " + id);
        }
        inFlight.add(taskId);
        touch();
    }

    public boolean finish(String taskId, boolean success) {
        if (!inFlight.remove(taskId)) {
            return false;
        }
        if (success) {
            succeeded++;
        } else {
            failed++;
        }
        touch();
        return true;
    }

    public void restoreCounts(int succeeded, int failed) {
        this.succeeded = succeeded;
        this.failed = failed;
    }

    public void queueResubmit(int index) {
        if (index >= cursor) {
            throw new IllegalArgumentException("Only submitted indices can be resubmitted: " + index);
        }
        resubmits.addLast(index);
    }

    /** 恢复时登记游标之后已有终态记录的下标，游标推进到它时直接跳过 */
    public void markSettled(int index) {
        if (index < cursor) {
            throw new IllegalArgumentException("Index " + index + " is already behind the cursor");
        }
        settledAhead.add(index);
        skipSettled();
    }

    private void skipSettled() {
        while (settledAhead.remove(cursor)) {
            cursor++;
        }
    }

    public void clearResubmits() {
        resubmits.clear();
    }

    public boolean isDrained() {
        return inFlight.isEmpty() && !hasNext();
    }

    public void transitionTo(BatchState next) {
        this.state = next;
        touch();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public Set<String> inFlightSnapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(inFlight));
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
