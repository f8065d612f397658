package com.mooncell.relay.api;

import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.TaskRecord;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class TaskView {
    private String id;
    private String link;
    private String requester;
    private String jobId;
    private String state;
    private String failureReason;
    private String detail;
    private Long byteSize;
    private Instant createdAt;
    private Instant finishedAt;

    public static TaskView from(RelayTask task) {
        return TaskView.builder()
                .id(task.getId())
                .link(task.getLink())
                .requester(task.getRequester())
                .jobId(task.getJobId())
                .state(task.getState().name())
                .failureReason(task.getFailureReason() == null ? null : task.getFailureReason().name())
                .detail(task.getFailureDetail())
                .byteSize(task.getByteSize() < 0 ? null : task.getByteSize())
                .createdAt(task.getCreatedAt())
                .finishedAt(task.getFinishedAt())
                .build();
    }

    public static TaskView from(TaskRecord record) {
        return TaskView.builder()
                .id(record.getTaskId())
                .link(record.getLink())
                .requester(record.getRequester())
                .jobId(record.getJobId())
                .state(record.getState())
                .failureReason(record.getFailureReason())
                .detail(record.getDetail())
                .byteSize(record.getByteSize())
                .finishedAt(record.getFinishedAt())
                .build();
    }
}
