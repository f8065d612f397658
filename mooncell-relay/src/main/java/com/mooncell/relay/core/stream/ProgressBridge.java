package com.mooncell.relay.core.stream;

import com.mooncell.relay.core.batch.BatchProgress;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 批量任务进度流。每个任务一个 sink，订阅方总能先拿到最近一次进度。
 */
@Component
public class ProgressBridge {

    // JobID -> Sink
    private final Map<String, Sinks.Many<BatchProgress>> sinks = new ConcurrentHashMap<>();

    public void open(String jobId) {
        // replay latest：页面晚订阅也能看到当前进度
        sinks.computeIfAbsent(jobId, id -> Sinks.many().replay().latest());
    }

    public void emit(String jobId, BatchProgress progress) {
        Sinks.Many<BatchProgress> sink = sinks.get(jobId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitNext(progress);
            }
        }
    }

    public void complete(String jobId) {
        Sinks.Many<BatchProgress> sink = sinks.remove(jobId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    public boolean isOpen(String jobId) {
        return sinks.containsKey(jobId);
    }

    /**
     * @return 进度流；任务不在运行中时返回 null
     */
    public Flux<BatchProgress> getFlux(String jobId) {
        Sinks.Many<BatchProgress> sink = sinks.get(jobId);
        return sink != null ? sink.asFlux() : null;
    }
}
