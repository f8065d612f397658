package com.mooncell.relay.core.task;

public class QueueClosedException extends RuntimeException {

    public QueueClosedException() {
        super("Task queue is shutting down");
    }
}
