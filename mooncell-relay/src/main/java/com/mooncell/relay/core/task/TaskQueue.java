package com.mooncell.relay.core.task;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.TaskRecord;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 有界 FIFO 任务队列。满了直接拒绝，不做无界增长。
 * 延迟重新入队由独立的调度线程完成，不占用 worker。
 */
@Slf4j
@Service
public class TaskQueue {

    private static final Duration REINSERT_RETRY = Duration.ofMillis(200);

    private final TaskHistoryStore historyStore;
    private final int capacity;

    // 内存阻塞队列
    private final BlockingQueue<RelayTask> queue;
    // 未到终态的任务（队列中、延迟中、运行中）
    private final Map<String, RelayTask> liveTasks = new ConcurrentHashMap<>();
    // 已结束的任务保留一段时间供查询
    private final Cache<String, RelayTask> finished;
    private final List<TaskCompletionListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService delayer;

    private volatile boolean accepting = true;

    public TaskQueue(RelayProperties properties, TaskHistoryStore historyStore) {
        this.historyStore = historyStore;
        this.capacity = properties.getQueueCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.finished = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(properties.getFinishedTaskTtl())
                .build();
        this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-requeue");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(TaskCompletionListener listener) {
        listeners.add(listener);
    }

    public void submit(RelayTask task) {
        if (!accepting) {
            throw new QueueClosedException();
        }
        liveTasks.put(task.getId(), task);
        if (!queue.offer(task)) {
            liveTasks.remove(task.getId());
            log.warn("Queue full, task {} rejected", task.getId());
            throw new QueueFullException(capacity);
        }
        log.debug("Task {} queued ({})", task.getId(), task.getLink());
    }

    public RelayTask poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void requeueLater(RelayTask task, Duration delay) {
        log.debug("Task {} requeued in {}", task.getId(), delay);
        delayer.schedule(() -> reinsert(task), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    private void reinsert(RelayTask task) {
        if (task.isTerminal()) {
            // 延迟期间已被取消
            return;
        }
        if (!accepting) {
            log.info("Queue closed, task {} left pending", task.getId());
            return;
        }
        if (!queue.offer(task)) {
            delayer.schedule(() -> reinsert(task), REINSERT_RETRY.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * 未开始的任务立即以 CANCELLED 失败；运行中的任务只打取消标记，由编排器在阶段之间检查
     */
    public boolean cancel(String taskId) {
        RelayTask task = liveTasks.get(taskId);
        if (task == null) {
            return false;
        }
        if (task.cancelIfPending()) {
            queue.remove(task);
            log.info("Task {} cancelled while pending", taskId);
            finish(task);
            return true;
        }
        if (!task.isTerminal()) {
            task.requestCancel();
            log.info("Task {} cancellation requested while running", taskId);
            return true;
        }
        return false;
    }

    /**
     * 任务进入终态：先写历史，再通知监听方
     */
    public void finish(RelayTask task) {
        if (!task.isTerminal()) {
            throw new IllegalStateException("Task " + task.getId() + " is not terminal: " + task.getState());
        }
        if (liveTasks.remove(task.getId()) == null) {
            return;
        }
        finished.put(task.getId(), task);
        try {
            historyStore.append(TaskRecord.of(task));
        } catch (RuntimeException e) {
            log.error("Failed to append history for task {}", task.getId(), e);
        }
        for (TaskCompletionListener listener : listeners) {
            try {
                listener.onTaskFinished(task);
            } catch (RuntimeException e) {
                log.error("Completion listener failed for task {}", task.getId(), e);
            }
        }
    }

    public Optional<RelayTask> find(String taskId) {
        RelayTask task = liveTasks.get(taskId);
        if (task == null) {
            task = finished.getIfPresent(taskId);
        }
        return Optional.ofNullable(task);
    }

    public int queuedCount() {
        return queue.size();
    }

    public int liveCount() {
        return liveTasks.size();
    }

    public boolean isAccepting() {
        return accepting;
    }

    public void close() {
        accepting = false;
    }

    @PreDestroy
    public void shutdown() {
        close();
        delayer.shutdownNow();
        log.info("Task queue stopped, {} tasks left pending", queue.size());
    }
}
