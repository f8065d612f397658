package com.mooncell.relay.core.batch;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.download.ReferenceResolver;
import com.mooncell.relay.core.history.BatchJobStore;
import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.BatchState;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.TaskRecord;
import com.mooncell.relay.core.model.TaskState;
import com.mooncell.relay.core.stream.ProgressBridge;
import com.mooncell.relay.core.task.QueueClosedException;
import com.mooncell.relay.core.task.QueueFullException;
import com.mooncell.relay.core.task.TaskCompletionListener;
import com.mooncell.relay.core.task.TaskQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 批量任务状态机。
 *
 * <p>同一任务最多同时有 window 个子任务在队列或运行中，每完成一个就补交下一个；
 * 每次完成后立即 checkpoint，进程重启时从最近一次 checkpoint 恢复。
 * 对单个 BatchJob 的所有修改都在该对象的锁内进行。
 */
@Slf4j
@Service
public class BatchController implements TaskCompletionListener {

    private final TaskQueue taskQueue;
    private final BatchJobStore jobStore;
    private final TaskHistoryStore historyStore;
    private final ReferenceResolver resolver;
    private final ProgressBridge progressBridge;
    private final RelayProperties.Batch config;

    // 未结束的任务，完成或取消后移除
    private final Map<String, BatchJob> activeJobs = new ConcurrentHashMap<>();
    // 已安排延迟补交的任务，避免重复调度
    private final Set<String> pendingPumps = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService pumpScheduler;

    public BatchController(TaskQueue taskQueue, BatchJobStore jobStore, TaskHistoryStore historyStore,
                           ReferenceResolver resolver, ProgressBridge progressBridge, RelayProperties properties) {
        this.taskQueue = taskQueue;
        this.jobStore = jobStore;
        this.historyStore = historyStore;
        this.resolver = resolver;
        this.progressBridge = progressBridge;
        this.config = properties.getBatch();
        this.pumpScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-batch-pump");
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        taskQueue.addListener(this);
        resumeInterrupted();
    }

    public BatchJob start(BatchRequest request) {
        List<String> links = request.isRange()
                ? resolver.expandRange(request.getLink(), request.getCount())
                : request.getLinks();
        if (links == null || links.isEmpty()) {
            throw new IllegalArgumentException("Batch has no references");
        }
        if (links.size() > config.getMaxSize()) {
            throw new BatchTooLargeException(links.size(), config.getMaxSize());
        }

        BatchJob job = new BatchJob(request.getOwner(), links);
        jobStore.create(job);
        activeJobs.put(job.getId(), job);
        progressBridge.open(job.getId());
        log.info("Batch {} started for {} with {} references", job.getId(), job.getOwner(), job.total());

        synchronized (job) {
            pump(job);
            afterChange(job);
        }
        return job;
    }

    @Override
    public void onTaskFinished(RelayTask task) {
        if (!task.belongsToBatch()) {
            return;
        }
        BatchJob job = activeJobs.get(task.getJobId());
        if (job == null) {
            log.debug("Task {} finished for inactive batch {}", task.getId(), task.getJobId());
            return;
        }
        synchronized (job) {
            if (!job.finish(task.getId(), task.getState() == TaskState.SUCCEEDED)) {
                return;
            }
            pump(job);
            afterChange(job);
        }
    }

    /**
     * 停止补交，未开始的子任务立即取消，运行中的子任务打取消标记；
     * 所有子任务到达终态后任务进入 CANCELLED
     */
    public BatchJob cancel(String jobId) {
        BatchJob job = activeJobs.get(jobId);
        if (job == null) {
            // 已结束或不存在
            return jobStore.find(jobId).orElseThrow(() -> new BatchNotFoundException(jobId));
        }
        synchronized (job) {
            if (job.getState() != BatchState.ACTIVE) {
                return job;
            }
            job.transitionTo(BatchState.CANCELLING);
            job.clearResubmits();
            jobStore.checkpoint(job);
            Set<String> inFlight = job.inFlightSnapshot();
            log.info("Cancelling batch {}, {} tasks in flight", jobId, inFlight.size());
            for (String taskId : inFlight) {
                // 未开始的任务会同步回调 onTaskFinished，锁可重入
                taskQueue.cancel(taskId);
            }
            afterChange(job);
        }
        return job;
    }

    public Optional<BatchJob> find(String jobId) {
        BatchJob job = activeJobs.get(jobId);
        if (job != null) {
            return Optional.of(job);
        }
        return jobStore.find(jobId);
    }

    public Flux<BatchProgress> progress(String jobId) {
        Flux<BatchProgress> live = progressBridge.getFlux(jobId);
        if (live != null) {
            return live;
        }
        // 已结束的任务只返回最终状态
        return find(jobId)
                .map(job -> Flux.just(BatchProgress.of(job)))
                .orElseGet(() -> Flux.error(new BatchNotFoundException(jobId)));
    }

    public int activeCount() {
        return activeJobs.size();
    }

    /**
     * 进程重启后恢复未完成的批量任务。
     *
     * <p>计数按历史记录重建，每个下标只计一次；游标之前没有终态记录的下标视为丢失，先重新提交，
     * 再从游标继续。游标之后已有终态记录的下标（写完历史、checkpoint 之前崩溃）不再提交。
     * 重启前处于 CANCELLING 的任务直接置为 CANCELLED。
     */
    void resumeInterrupted() {
        List<BatchJob> unfinished = jobStore.findUnfinished();
        if (unfinished.isEmpty()) {
            return;
        }
        log.info("Resuming {} interrupted batches", unfinished.size());
        for (BatchJob job : unfinished) {
            try {
                resume(job);
            } catch (RuntimeException e) {
                log.error("Failed to resume batch {}", job.getId(), e);
            }
        }
    }

    private void resume(BatchJob job) {
        Map<Integer, Boolean> outcomes = new HashMap<>();
        for (TaskRecord record : historyStore.findByJob(job.getId())) {
            if (record.getRefIndex() != null) {
                outcomes.merge(record.getRefIndex(), record.isSucceeded(), Boolean::logicalOr);
            }
        }
        int succeeded = (int) outcomes.values().stream().filter(Boolean::booleanValue).count();
        job.restoreCounts(succeeded, outcomes.size() - succeeded);

        if (job.getState() == BatchState.CANCELLING) {
            job.transitionTo(BatchState.CANCELLED);
            jobStore.checkpoint(job);
            log.info("Batch {} was cancelling before restart, marked cancelled", job.getId());
            return;
        }

        int storedCursor = job.getCursor();
        for (int i = 0; i < storedCursor; i++) {
            if (!outcomes.containsKey(i)) {
                job.queueResubmit(i);
            }
        }
        outcomes.keySet().stream()
                .filter(i -> i >= storedCursor && i < job.total())
                .sorted()
                .forEach(job::markSettled);
        activeJobs.put(job.getId(), job);
        progressBridge.open(job.getId());
        log.info("Batch {} resumed at {}/{} ({} succeeded, {} failed)",
                job.getId(), job.getCursor(), job.total(), job.getSucceeded(), job.getFailed());
        synchronized (job) {
            pump(job);
            afterChange(job);
        }
    }

    // 调用方持有 job 锁
    private void pump(BatchJob job) {
        while (job.getState() == BatchState.ACTIVE && job.hasNext() && job.inFlightCount() < config.getWindow()) {
            int index = job.nextIndex();
            RelayTask task = RelayTask.forBatch(job.getId(), index, job.getOwner(), job.getReferences().get(index));
            try {
                taskQueue.submit(task);
            } catch (QueueFullException e) {
                log.info("Queue full while pumping batch {}, retry in {}", job.getId(), config.getResubmitDelay());
                schedulePump(job);
                return;
            } catch (QueueClosedException e) {
                log.info("Queue closed, batch {} paused at {}", job.getId(), job.getCursor());
                return;
            }
            job.markSubmitted(index, task.getId());
        }
    }

    private void schedulePump(BatchJob job) {
        if (!pendingPumps.add(job.getId())) {
            return;
        }
        pumpScheduler.schedule(() -> {
            pendingPumps.remove(job.getId());
            synchronized (job) {
                pump(job);
                afterChange(job);
            }
        }, config.getResubmitDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    // 调用方持有 job 锁：判断是否结束，写 checkpoint，推送进度
    private void afterChange(BatchJob job) {
        if (job.getState() == BatchState.ACTIVE && job.isDrained()) {
            job.transitionTo(BatchState.COMPLETED);
            log.info("Batch {} completed: {} succeeded, {} failed", job.getId(), job.getSucceeded(), job.getFailed());
        } else if (job.getState() == BatchState.CANCELLING && job.inFlightCount() == 0) {
            job.transitionTo(BatchState.CANCELLED);
            log.info("Batch {} cancelled: {} succeeded, {} failed", job.getId(), job.getSucceeded(), job.getFailed());
        }
        jobStore.checkpoint(job);
        progressBridge.emit(job.getId(), BatchProgress.of(job));

        if (job.getState().isFinished()) {
            activeJobs.remove(job.getId());
            progressBridge.complete(job.getId());
        }
    }

    @PreDestroy
    public void shutdown() {
        pumpScheduler.shutdownNow();
    }
}
