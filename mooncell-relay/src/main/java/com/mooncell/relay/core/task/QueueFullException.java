package com.mooncell.relay.core.task;

public class QueueFullException extends RuntimeException {

    public QueueFullException(int capacity) {
        super("System busy: task queue full (capacity " + capacity + ")");
    }
}
