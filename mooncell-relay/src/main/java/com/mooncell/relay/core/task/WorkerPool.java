package com.mooncell.relay.core.task;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.download.DownloadOrchestrator;
import com.mooncell.relay.core.model.FailureReason;
import com.mooncell.relay.core.model.RelayTask;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 固定数量的 worker 按 FIFO 消费队列。worker 数量是唯一的并发开关，
 * 与同时存在多少个批量任务无关。
 */
@Slf4j
@Service
public class WorkerPool {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final TaskQueue taskQueue;
    private final DownloadOrchestrator orchestrator;
    private final int workerCount;
    private final ExecutorService executor;
    private final AtomicInteger busy = new AtomicInteger();

    private volatile boolean running;

    public WorkerPool(TaskQueue taskQueue, DownloadOrchestrator orchestrator, RelayProperties properties) {
        this.taskQueue = taskQueue;
        this.orchestrator = orchestrator;
        this.workerCount = properties.getWorkers();
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerCount, r -> new Thread(r, "relay-worker-" + seq.getAndIncrement()));
    }

    @PostConstruct
    public void start() {
        if (running) {
            return;
        }
        running = true;
        for (int i = 0; i < workerCount; i++) {
            int workerId = i;
            executor.submit(() -> workerLoop(workerId));
        }
        log.info("Worker pool started with {} workers", workerCount);
    }

    private void workerLoop(int workerId) {
        while (running) {
            RelayTask task;
            try {
                task = taskQueue.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (task == null) {
                continue;
            }
            busy.incrementAndGet();
            try {
                process(task, workerId);
            } finally {
                busy.decrementAndGet();
            }
        }
        log.debug("Worker {} stopped", workerId);
    }

    void process(RelayTask task, int workerId) {
        if (!task.markRunning()) {
            log.debug("Task {} is {}, skip", task.getId(), task.getState());
            return;
        }
        log.debug("Worker {} running task {}", workerId, task.getId());

        Disposition disposition;
        try {
            disposition = orchestrator.execute(task);
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", task.getId(), e);
            task.fail(FailureReason.UPSTREAM_ERROR, e.getMessage());
            disposition = Disposition.done();
        }

        if (disposition.isRequeue() && !task.isTerminal()) {
            if (task.isCancelRequested()) {
                task.fail(FailureReason.CANCELLED, "Cancelled while waiting for retry");
                taskQueue.finish(task);
                return;
            }
            task.backToPending();
            taskQueue.requeueLater(task, disposition.getDelay());
            return;
        }
        taskQueue.finish(task);
    }

    public int busyWorkers() {
        return busy.get();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * 停止接收新任务，等待正在执行的任务跑到终态后返回；
     * 队列中尚未开始的任务保持 PENDING
     */
    @PreDestroy
    public void shutdown() {
        log.info("Stopping worker pool, {} busy", busy.get());
        // 先让 worker 停止取新任务，再关闭队列入口
        running = false;
        taskQueue.close();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish in {}, interrupting", SHUTDOWN_TIMEOUT);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
