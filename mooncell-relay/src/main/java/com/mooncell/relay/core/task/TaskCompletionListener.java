package com.mooncell.relay.core.task;

import com.mooncell.relay.core.model.RelayTask;

/**
 * 任务进入终态后的回调。回调在完成任务的线程上同步执行，实现方不应阻塞。
 */
public interface TaskCompletionListener {

    void onTaskFinished(RelayTask task);
}
