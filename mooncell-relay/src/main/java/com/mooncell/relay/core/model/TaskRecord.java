package com.mooncell.relay.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 对应 relay_task_history 表，只追加不修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRecord {

    // 与表结构中的列宽一致
    static final int MAX_LINK_LENGTH = 512;
    static final int MAX_DETAIL_LENGTH = 1024;

    private String taskId;
    private String jobId;
    private Integer refIndex;
    private String requester;
    private String link;
    private String state;
    private String failureReason;
    private String detail;
    private Long byteSize;
    private Instant finishedAt;

    public static TaskRecord of(RelayTask task) {
        return TaskRecord.builder()
                .taskId(task.getId())
                .jobId(task.getJobId())
                .refIndex(task.belongsToBatch() ? task.getRefIndex() : null)
                .requester(task.getRequester())
                .link(truncate(task.getLink(), MAX_LINK_LENGTH))
                .state(task.getState().name())
                .failureReason(task.getFailureReason() == null ? null : task.getFailureReason().name())
                .detail(truncate(task.getFailureDetail(), MAX_DETAIL_LENGTH))
                .byteSize(task.getByteSize() < 0 ? null : task.getByteSize())
                .finishedAt(task.getFinishedAt() == null ? Instant.now() : task.getFinishedAt())
                .build();
    }

    public boolean isSucceeded() {
        return TaskState.SUCCEEDED.name().equals(state);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max - 3) + "...";
    }
}
