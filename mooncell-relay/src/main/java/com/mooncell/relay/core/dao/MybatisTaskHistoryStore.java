package com.mooncell.relay.core.dao;

import com.mooncell.relay.core.history.TaskHistoryStore;
import com.mooncell.relay.core.model.TaskRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class MybatisTaskHistoryStore implements TaskHistoryStore {

    private final TaskHistoryMapper mapper;

    @Override
    public void append(TaskRecord record) {
        mapper.insert(record);
    }

    @Override
    public List<TaskRecord> findByJob(String jobId) {
        return mapper.findByJobId(jobId);
    }

    @Override
    public List<TaskRecord> findRecent(String requester, int limit) {
        return mapper.findRecent(requester, limit);
    }
}
