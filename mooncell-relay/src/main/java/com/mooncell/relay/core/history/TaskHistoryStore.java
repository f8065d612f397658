package com.mooncell.relay.core.history;

import com.mooncell.relay.core.model.TaskRecord;

import java.util.List;

/**
 * 任务结果的追加式历史，用于状态查询以及批量任务的断点恢复
 */
public interface TaskHistoryStore {

    void append(TaskRecord record);

    List<TaskRecord> findByJob(String jobId);

    List<TaskRecord> findRecent(String requester, int limit);
}
