package com.mooncell.relay.core.batch;

import lombok.Getter;

@Getter
public class BatchTooLargeException extends RuntimeException {

    private final int requested;
    private final int maxSize;

    public BatchTooLargeException(int requested, int maxSize) {
        super("Batch of " + requested + " references exceeds the limit of " + maxSize);
        this.requested = requested;
        this.maxSize = maxSize;
    }
}
