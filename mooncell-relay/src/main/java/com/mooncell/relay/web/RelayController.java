package com.mooncell.relay.web;

import com.mooncell.relay.api.BatchSubmitRequest;
import com.mooncell.relay.api.BatchView;
import com.mooncell.relay.api.RelayRequest;
import com.mooncell.relay.api.TaskView;
import com.mooncell.relay.core.batch.BatchController;
import com.mooncell.relay.core.batch.BatchNotFoundException;
import com.mooncell.relay.core.batch.BatchProgress;
import com.mooncell.relay.core.download.ReferenceResolver;
import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.task.TaskNotFoundException;
import com.mooncell.relay.core.task.TaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class RelayController {

    private final TaskQueue taskQueue;
    private final BatchController batchController;
    private final TaskHistoryStore historyStore;
    private final ReferenceResolver resolver;

    /**
     * 单条转发：校验链接 -> 入队，立即返回任务 id
     */
    @PostMapping("/relay")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public TaskView relay(@RequestBody RelayRequest request) {
        requireText(request.getRequester(), "requester");
        RelayTask task = RelayTask.single(request.getRequester(), request.getLink());
        // 提前解析，格式错误直接 400，不占用队列
        task.setReference(resolver.resolve(request.getLink()));
        taskQueue.submit(task);
        log.info("Relay {} accepted for {}: {}", task.getId(), task.getRequester(), task.getLink());
        return TaskView.from(task);
    }

    @GetMapping("/tasks/{id}")
    public TaskView getTask(@PathVariable String id) {
        return taskQueue.find(id)
                .map(TaskView::from)
                .orElseThrow(() -> new TaskNotFoundException(id));
    }

    @DeleteMapping("/tasks/{id}")
    public TaskView cancelTask(@PathVariable String id) {
        RelayTask task = taskQueue.find(id).orElseThrow(() -> new TaskNotFoundException(id));
        taskQueue.cancel(id);
        return TaskView.from(task);
    }

    @GetMapping("/tasks")
    public List<TaskView> history(@RequestParam String requester,
                                  @RequestParam(defaultValue = "20") int limit) {
        return historyStore.findRecent(requester, Math.min(Math.max(limit, 1), 200)).stream()
                .map(TaskView::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/batches")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public BatchView startBatch(@RequestBody BatchSubmitRequest request) {
        requireText(request.getOwner(), "owner");
        BatchJob job = batchController.start(request.toBatchRequest());
        synchronized (job) {
            return BatchView.from(job);
        }
    }

    @GetMapping("/batches/{id}")
    public BatchView getBatch(@PathVariable String id) {
        BatchJob job = batchController.find(id).orElseThrow(() -> new BatchNotFoundException(id));
        synchronized (job) {
            return BatchView.from(job);
        }
    }

    @DeleteMapping("/batches/{id}")
    public BatchView cancelBatch(@PathVariable String id) {
        BatchJob job = batchController.cancel(id);
        synchronized (job) {
            return BatchView.from(job);
        }
    }

    @GetMapping(value = "/batches/{id}/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<BatchProgress> progress(@PathVariable String id) {
        return batchController.progress(id)
                .doOnCancel(() -> log.debug("Progress subscriber for batch {} left", id));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
