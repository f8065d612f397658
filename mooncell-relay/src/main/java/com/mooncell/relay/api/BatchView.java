package com.mooncell.relay.api;

import com.mooncell.relay.core.model.BatchJob;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class BatchView {
    private String id;
    private String owner;
    private String state;
    private int total;
    private int submitted;
    private int succeeded;
    private int failed;
    private int inFlight;
    private Instant createdAt;
    private Instant updatedAt;

    public static BatchView from(BatchJob job) {
        return BatchView.builder()
                .id(job.getId())
                .owner(job.getOwner())
                .state(job.getState().name())
                .total(job.total())
                .submitted(job.getCursor())
                .succeeded(job.getSucceeded())
                .failed(job.getFailed())
                .inFlight(job.inFlightCount())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
