package com.mooncell.relay.core.dao;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mooncell.relay.core.history.BatchJobStore;
import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.BatchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class MybatisBatchJobStore implements BatchJobStore {

    private static final TypeReference<List<String>> REFERENCE_LIST = new TypeReference<>() { };

    private final BatchJobMapper mapper;
    private final ObjectMapper objectMapper;

    @Override
    public void create(BatchJob job) {
        BatchJobRecord record = toRecord(job);
        try {
            record.setReferencesJson(objectMapper.writeValueAsString(job.getReferences()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize references of job " + job.getId(), e);
        }
        mapper.insert(record);
    }

    @Override
    public void checkpoint(BatchJob job) {
        if (mapper.updateCheckpoint(toRecord(job)) == 0) {
            log.warn("Stale checkpoint ignored for job {} at cursor {}", job.getId(), job.getCursor());
        }
    }

    @Override
    public Optional<BatchJob> find(String jobId) {
        return Optional.ofNullable(mapper.findById(jobId)).map(this::toJob);
    }

    @Override
    public List<BatchJob> findUnfinished() {
        List<BatchJob> jobs = new ArrayList<>();
        for (BatchJobRecord record : mapper.findUnfinished()) {
            jobs.add(toJob(record));
        }
        return jobs;
    }

    private BatchJobRecord toRecord(BatchJob job) {
        return BatchJobRecord.builder()
                .id(job.getId())
                .owner(job.getOwner())
                .nextIndex(job.getCursor())
                .succeeded(job.getSucceeded())
                .failed(job.getFailed())
                .state(job.getState().name())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }

    private BatchJob toJob(BatchJobRecord record) {
        try {
            List<String> references = objectMapper.readValue(record.getReferencesJson(), REFERENCE_LIST);
            return new BatchJob(record.getId(), record.getOwner(), references,
                    record.getNextIndex(), record.getSucceeded(), record.getFailed(),
                    BatchState.valueOf(record.getState()), record.getCreatedAt());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted references for job " + record.getId(), e);
        }
    }
}
