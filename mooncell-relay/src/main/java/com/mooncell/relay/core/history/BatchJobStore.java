package com.mooncell.relay.core.history;

import com.mooncell.relay.core.model.BatchJob;

import java.util.List;
import java.util.Optional;

public interface BatchJobStore {

    void create(BatchJob job);

    /**
     * 保存游标与计数。实现必须保证已保存的游标不会被更小的值覆盖。
     */
    void checkpoint(BatchJob job);

    Optional<BatchJob> find(String jobId);

    /** ACTIVE 或 CANCELLING 状态的任务，用于进程重启后恢复 */
    List<BatchJob> findUnfinished();
}
