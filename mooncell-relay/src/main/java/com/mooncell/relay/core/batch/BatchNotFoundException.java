package com.mooncell.relay.core.batch;

public class BatchNotFoundException extends RuntimeException {

    public BatchNotFoundException(String jobId) {
        super("Batch job not found: " + jobId);
    }
}
