package com.mooncell.relay.core.task;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * 编排器对一次执行的处理结论：任务已到终态，或需要延迟后重新入队
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Disposition {

    private static final Disposition DONE = new Disposition(false, Duration.ZERO);

    private final boolean requeue;
    private final Duration delay;

    public static Disposition done() {
        return DONE;
    }

    public static Disposition requeue(Duration delay) {
        return new Disposition(true, delay);
    }
}
