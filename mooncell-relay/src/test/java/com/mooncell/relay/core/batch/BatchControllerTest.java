package com.mooncell.relay.core.batch;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.download.ReferenceResolver;
import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.BatchState;
import com.mooncell.relay.core.model.FailureReason;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.TaskRecord;
import com.mooncell.relay.core.model.TaskState;
import com.mooncell.relay.core.stream.ProgressBridge;
import com.mooncell.relay.core.task.TaskQueue;
import com.mooncell.relay.support.InMemoryBatchJobStore;
import com.mooncell.relay.support.InMemoryTaskHistoryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchControllerTest {

    private final InMemoryBatchJobStore jobStore = new InMemoryBatchJobStore();
    private final InMemoryTaskHistoryStore historyStore = new InMemoryTaskHistoryStore();
    private TaskQueue queue;
    private BatchController controller;

    private void startController(int queueCapacity) {
        RelayProperties properties = new RelayProperties();
        properties.setQueueCapacity(queueCapacity);
        properties.getBatch().setResubmitDelay(Duration.ofMillis(200));
        queue = new TaskQueue(properties, historyStore);
        controller = new BatchController(queue, jobStore, historyStore, new ReferenceResolver(),
                new ProgressBridge(), properties);
        controller.init();
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
        queue.shutdown();
    }

    private static List<String> links(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> "https://t.me/durov/" + i)
                .collect(Collectors.toList());
    }

    private List<RelayTask> drainQueue() throws InterruptedException {
        List<RelayTask> tasks = new ArrayList<>();
        RelayTask task;
        while ((task = queue.poll(Duration.ofMillis(5))) != null) {
            tasks.add(task);
        }
        return tasks;
    }

    private void complete(RelayTask task, boolean success) {
        task.markRunning();
        if (success) {
            task.succeed(1);
        } else {
            task.fail(FailureReason.NOT_FOUND, "gone");
        }
        queue.finish(task);
    }

    @Test
    void submitsOnlyTheLookAheadWindow() {
        startController(500);

        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(12)));

        assertThat(queue.queuedCount()).isEqualTo(5);
        assertThat(job.getCursor()).isEqualTo(5);
        assertThat(job.getState()).isEqualTo(BatchState.ACTIVE);
    }

    @Test
    void outOfOrderCompletionsKeepCursorMonotonic() throws InterruptedException {
        startController(500);
        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(23)));
        Random random = new Random(7);

        List<RelayTask> batch;
        while (!(batch = drainQueue()).isEmpty()) {
            Collections.shuffle(batch, random);
            for (RelayTask task : batch) {
                complete(task, random.nextInt(4) != 0);
            }
        }

        assertThat(job.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(job.resolved()).isEqualTo(23);
        assertThat(job.getCursor()).isEqualTo(23);
        List<Integer> cursors = jobStore.getCheckpointedCursors();
        for (int i = 1; i < cursors.size(); i++) {
            assertThat(cursors.get(i)).isGreaterThanOrEqualTo(cursors.get(i - 1));
        }
        assertThat(jobStore.find(job.getId()).orElseThrow().getState()).isEqualTo(BatchState.COMPLETED);
    }

    @Test
    void singleFailureDoesNotAbortBatch() throws InterruptedException {
        startController(500);
        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(3)));

        List<RelayTask> tasks = drainQueue();
        complete(tasks.get(0), false);
        complete(tasks.get(1), true);

        assertThat(job.getState()).isEqualTo(BatchState.ACTIVE);
        assertThat(job.getFailed()).isEqualTo(1);

        complete(tasks.get(2), true);
        assertThat(job.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(job.getSucceeded()).isEqualTo(2);
    }

    @Test
    void cancelFailsPendingNowAndWaitsForRunning() throws InterruptedException {
        startController(500);
        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(10)));
        RelayTask runningA = queue.poll(Duration.ofMillis(5));
        RelayTask runningB = queue.poll(Duration.ofMillis(5));
        runningA.markRunning();
        runningB.markRunning();

        controller.cancel(job.getId());

        assertThat(job.getState()).isEqualTo(BatchState.CANCELLING);
        assertThat(job.getFailed()).isEqualTo(3);
        assertThat(queue.queuedCount()).isZero();
        assertThat(historyStore.findByJob(job.getId()))
                .extracting(TaskRecord::getFailureReason)
                .containsOnly("CANCELLED")
                .hasSize(3);
        assertThat(runningA.isCancelRequested()).isTrue();

        runningA.succeed(1);
        queue.finish(runningA);
        assertThat(job.getState()).isEqualTo(BatchState.CANCELLING);

        runningB.fail(FailureReason.CANCELLED, "Cancelled before delivery");
        queue.finish(runningB);

        assertThat(job.getState()).isEqualTo(BatchState.CANCELLED);
        assertThat(job.getSucceeded()).isEqualTo(1);
        assertThat(job.getFailed()).isEqualTo(4);
        assertThat(job.getCursor()).isEqualTo(5);
        assertThat(queue.queuedCount()).isZero();
    }

    @Test
    void rejectsOversizedAndEmptyBatches() {
        startController(500);

        assertThatThrownBy(() -> controller.start(BatchRequest.ofLinks("alice", links(101))))
                .isInstanceOf(BatchTooLargeException.class);
        assertThatThrownBy(() -> controller.start(BatchRequest.ofLinks("alice", List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangeRequestExpandsToConsecutiveMessages() {
        startController(500);

        BatchJob job = controller.start(BatchRequest.ofRange("alice", "https://t.me/durov/10", 3));

        assertThat(job.getReferences()).containsExactly(
                "https://t.me/durov/10", "https://t.me/durov/11", "https://t.me/durov/12");
    }

    @Test
    void fullQueueIsRetriedLater() throws InterruptedException {
        startController(3);
        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(8)));
        assertThat(job.getCursor()).isEqualTo(3);

        List<RelayTask> taken = drainQueue();
        assertThat(taken).hasSize(3);

        long deadline = System.currentTimeMillis() + 2000;
        while (queue.queuedCount() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(queue.queuedCount()).isEqualTo(2);
        synchronized (job) {
            assertThat(job.getCursor()).isEqualTo(5);
        }
    }

    @Test
    void resumeResubmitsUnresolvedIndicesBeforeContinuing() throws InterruptedException {
        List<String> refs = links(6);
        BatchJob interrupted = new BatchJob("job-1", "alice", refs, 4, 0, 0, BatchState.ACTIVE, Instant.now());
        jobStore.create(interrupted);
        historyStore.append(record("job-1", 0, TaskState.SUCCEEDED));
        historyStore.append(record("job-1", 2, TaskState.FAILED));

        startController(500);

        BatchJob job = controller.find("job-1").orElseThrow();
        assertThat(job.getSucceeded()).isEqualTo(1);
        assertThat(job.getFailed()).isEqualTo(1);
        assertThat(job.getCursor()).isEqualTo(6);

        List<RelayTask> resubmitted = drainQueue();
        assertThat(resubmitted).extracting(RelayTask::getRefIndex).containsExactly(1, 3, 4, 5);

        for (RelayTask task : resubmitted) {
            complete(task, true);
        }
        assertThat(job.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(job.getSucceeded()).isEqualTo(5);
    }

    @Test
    void resumeSkipsIndicesSettledAheadOfTheCursor() throws InterruptedException {
        // 历史已写入、checkpoint 尚未落盘时崩溃：下标 3 已成功但游标停在 2
        jobStore.create(new BatchJob("job-3", "alice", links(4), 2, 0, 0, BatchState.ACTIVE, Instant.now()));
        historyStore.append(record("job-3", 0, TaskState.SUCCEEDED));
        historyStore.append(record("job-3", 3, TaskState.SUCCEEDED));

        startController(500);

        List<RelayTask> resubmitted = drainQueue();
        assertThat(resubmitted).extracting(RelayTask::getRefIndex).containsExactly(1, 2);

        BatchJob job = controller.find("job-3").orElseThrow();
        for (RelayTask task : resubmitted) {
            complete(task, true);
        }
        assertThat(job.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(job.getSucceeded()).isEqualTo(4);
        assertThat(job.resolved()).isEqualTo(job.total());
        assertThat(job.getCursor()).isEqualTo(4);
    }

    @Test
    void resumeCompletesJobWhoseRemainingIndicesAreAllSettled() {
        jobStore.create(new BatchJob("job-4", "alice", links(3), 1, 0, 0, BatchState.ACTIVE, Instant.now()));
        historyStore.append(record("job-4", 0, TaskState.SUCCEEDED));
        historyStore.append(record("job-4", 1, TaskState.FAILED));
        historyStore.append(record("job-4", 2, TaskState.SUCCEEDED));

        startController(500);

        assertThat(queue.queuedCount()).isZero();
        BatchJob stored = jobStore.find("job-4").orElseThrow();
        assertThat(stored.getState()).isEqualTo(BatchState.COMPLETED);
        assertThat(stored.getSucceeded()).isEqualTo(2);
        assertThat(stored.getFailed()).isEqualTo(1);
    }

    @Test
    void jobCancellingAtRestartEndsCancelled() {
        jobStore.create(new BatchJob("job-2", "alice", links(4), 2, 0, 0, BatchState.CANCELLING, Instant.now()));
        historyStore.append(record("job-2", 0, TaskState.SUCCEEDED));

        startController(500);

        assertThat(queue.queuedCount()).isZero();
        BatchJob stored = jobStore.find("job-2").orElseThrow();
        assertThat(stored.getState()).isEqualTo(BatchState.CANCELLED);
        assertThat(stored.getSucceeded()).isEqualTo(1);
    }

    @Test
    void progressReplaysLatestAndCompletes() throws InterruptedException {
        startController(500);
        BatchJob job = controller.start(BatchRequest.ofLinks("alice", links(2)));
        List<RelayTask> tasks = drainQueue();

        StepVerifier.create(controller.progress(job.getId()))
                .assertNext(p -> assertThat(p.getState()).isEqualTo(BatchState.ACTIVE))
                .then(() -> tasks.forEach(t -> complete(t, true)))
                .assertNext(p -> assertThat(p.getSucceeded()).isEqualTo(1))
                .assertNext(p -> {
                    assertThat(p.getState()).isEqualTo(BatchState.COMPLETED);
                    assertThat(p.getPercent()).isEqualTo(100);
                })
                .verifyComplete();

        StepVerifier.create(controller.progress(job.getId()))
                .assertNext(p -> assertThat(p.getState()).isEqualTo(BatchState.COMPLETED))
                .verifyComplete();
    }

    @Test
    void unknownBatchIsReported() {
        startController(500);

        assertThatThrownBy(() -> controller.cancel("missing")).isInstanceOf(BatchNotFoundException.class);
        StepVerifier.create(controller.progress("missing"))
                .expectError(BatchNotFoundException.class)
                .verify();
    }

    private static TaskRecord record(String jobId, int index, TaskState state) {
        return TaskRecord.builder()
                .taskId("t-" + index)
                .jobId(jobId)
                .refIndex(index)
                .requester("alice")
                .state(state.name())
                .finishedAt(Instant.now())
                .build();
    }
}
