package com.mooncell.relay.core.task;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.FailureReason;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.TaskRecord;
import com.mooncell.relay.core.model.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaskQueueTest {

    @Mock
    private TaskHistoryStore historyStore;

    private TaskQueue queue;
    private final List<RelayTask> finished = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.setQueueCapacity(2);
        queue = new TaskQueue(properties, historyStore);
        queue.addListener(finished::add);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private static RelayTask task(int id) {
        return RelayTask.single("alice", "https://t.me/durov/" + id);
    }

    @Test
    void rejectsSubmissionPastCapacity() {
        queue.submit(task(1));
        queue.submit(task(2));
        RelayTask third = task(3);

        assertThatThrownBy(() -> queue.submit(third)).isInstanceOf(QueueFullException.class);
        assertThat(queue.find(third.getId())).isEmpty();
        assertThat(queue.queuedCount()).isEqualTo(2);
    }

    @Test
    void dequeuesInSubmissionOrder() throws InterruptedException {
        RelayTask first = task(1);
        RelayTask second = task(2);
        queue.submit(first);
        queue.submit(second);

        assertThat(queue.poll(Duration.ofMillis(10))).isSameAs(first);
        assertThat(queue.poll(Duration.ofMillis(10))).isSameAs(second);
        assertThat(queue.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void cancellingPendingTaskFinishesItImmediately() {
        RelayTask task = task(1);
        queue.submit(task);

        assertThat(queue.cancel(task.getId())).isTrue();

        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(task.getFailureReason()).isEqualTo(FailureReason.CANCELLED);
        assertThat(queue.queuedCount()).isZero();
        assertThat(finished).containsExactly(task);
        ArgumentCaptor<TaskRecord> record = ArgumentCaptor.forClass(TaskRecord.class);
        verify(historyStore).append(record.capture());
        assertThat(record.getValue().getFailureReason()).isEqualTo("CANCELLED");
    }

    @Test
    void cancellingRunningTaskOnlyRequestsIt() throws InterruptedException {
        RelayTask task = task(1);
        queue.submit(task);
        queue.poll(Duration.ofMillis(10)).markRunning();

        assertThat(queue.cancel(task.getId())).isTrue();

        assertThat(task.getState()).isEqualTo(TaskState.RUNNING);
        assertThat(task.isCancelRequested()).isTrue();
        assertThat(finished).isEmpty();
    }

    @Test
    void finishedTaskStaysVisible() {
        RelayTask task = task(1);
        queue.submit(task);
        task.markRunning();
        task.succeed(42);

        queue.finish(task);
        queue.finish(task);

        assertThat(queue.find(task.getId())).contains(task);
        assertThat(queue.liveCount()).isZero();
        assertThat(finished).containsExactly(task);
    }

    @Test
    void finishRejectsNonTerminalTask() {
        RelayTask task = task(1);
        queue.submit(task);

        assertThatThrownBy(() -> queue.finish(task)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void requeuedTaskComesBackAfterDelay() throws InterruptedException {
        RelayTask task = task(1);
        queue.submit(task);
        queue.poll(Duration.ofMillis(10));

        queue.requeueLater(task, Duration.ofMillis(50));

        assertThat(queue.poll(Duration.ofSeconds(2))).isSameAs(task);
    }

    @Test
    void cancelledWhileDelayedIsNotReinserted() throws InterruptedException {
        RelayTask task = task(1);
        queue.submit(task);
        queue.poll(Duration.ofMillis(10));
        queue.requeueLater(task, Duration.ofMillis(50));

        queue.cancel(task.getId());

        assertThat(queue.poll(Duration.ofMillis(300))).isNull();
        assertThat(task.getFailureReason()).isEqualTo(FailureReason.CANCELLED);
    }

    @Test
    void closedQueueRejectsSubmission() {
        queue.close();

        assertThatThrownBy(() -> queue.submit(task(1))).isInstanceOf(QueueClosedException.class);
    }
}
