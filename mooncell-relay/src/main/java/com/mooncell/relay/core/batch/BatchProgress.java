package com.mooncell.relay.core.batch;

import com.mooncell.relay.core.model.BatchJob;
import com.mooncell.relay.core.model.BatchState;
import lombok.Value;

import java.time.Instant;

@Value
public class BatchProgress {
    String jobId;
    BatchState state;
    int total;
    int submitted;
    int succeeded;
    int failed;
    int inFlight;
    Instant at;

    public static BatchProgress of(BatchJob job) {
        return new BatchProgress(job.getId(), job.getState(), job.total(), job.getCursor(),
                job.getSucceeded(), job.getFailed(), job.inFlightCount(), Instant.now());
    }

    public int getPercent() {
        return total == 0 ? 100 : (succeeded + failed) * 100 / total;
    }
}
