package com.mooncell.relay.web;

import com.mooncell.relay.api.SessionRequest;
import com.mooncell.relay.api.SessionView;
import com.mooncell.relay.api.TrafficLimitsRequest;
import com.mooncell.relay.core.batch.BatchController;
import com.mooncell.relay.core.ratelimit.AdaptiveRateLimiter;
import com.mooncell.relay.core.session.ClientHandle;
import com.mooncell.relay.core.session.ClientPool;
import com.mooncell.relay.core.session.ConnectivityEvent;
import com.mooncell.relay.core.task.TaskQueue;
import com.mooncell.relay.core.task.WorkerPool;
import com.mooncell.relay.core.traffic.TrafficLedgerService;
import com.mooncell.relay.core.traffic.TrafficLimits;
import com.mooncell.relay.core.traffic.TrafficResetScope;
import com.mooncell.relay.core.traffic.TrafficUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private final ClientPool clientPool;
    private final AdaptiveRateLimiter rateLimiter;
    private final TaskQueue taskQueue;
    private final WorkerPool workerPool;
    private final BatchController batchController;
    private final TrafficLedgerService trafficLedger;

    // 运行状态总览：队列、worker、限流器、会话
    @GetMapping("/monitor")
    public Map<String, Object> monitor() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("queued", taskQueue.queuedCount());
        status.put("live", taskQueue.liveCount());
        status.put("workers", workerPool.getWorkerCount());
        status.put("busyWorkers", workerPool.busyWorkers());
        status.put("activeBatches", batchController.activeCount());
        status.put("rateLimiter", rateLimiter.snapshot());
        status.put("sessions", sessions());
        return status;
    }

    @GetMapping("/sessions")
    public List<SessionView> sessions() {
        return clientPool.snapshot().stream()
                .map(SessionView::from)
                .collect(Collectors.toList());
    }

    // 注册或替换用户的特权会话，连接异步进行
    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionView register(@RequestBody SessionRequest request) {
        if (request.getRequester() == null || request.getRequester().isBlank()
                || request.getCredential() == null || request.getCredential().isBlank()) {
            throw new IllegalArgumentException("requester and credential are required");
        }
        ClientHandle handle = clientPool.register(request.getRequester(), request.getCredential());
        return SessionView.from(handle);
    }

    @DeleteMapping("/sessions/{requester}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unregister(@PathVariable String requester) {
        clientPool.unregister(requester);
    }

    @GetMapping(value = "/sessions/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ConnectivityEvent> events() {
        return clientPool.events();
    }

    // 所有用户合计用量与当前限制
    @GetMapping("/traffic")
    public Map<String, Object> totalTraffic() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("limits", trafficLedger.getLimits());
        report.put("usage", trafficLedger.totalUsage());
        return report;
    }

    @GetMapping("/traffic/{userId}")
    public Map<String, Object> userTraffic(@PathVariable String userId) {
        TrafficLimits limits = trafficLedger.getLimits();
        TrafficUsage usage = trafficLedger.usage(userId);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("limits", limits);
        report.put("usage", usage);
        if (limits.isEnabled()) {
            report.put("dailyRemaining", Math.max(0, limits.getDailyLimit() - usage.getDaily()));
            report.put("monthlyRemaining", Math.max(0, limits.getMonthlyLimit() - usage.getMonthly()));
        }
        return report;
    }

    @PutMapping("/traffic/limits")
    public TrafficLimits updateLimits(@RequestBody TrafficLimitsRequest request) {
        return trafficLedger.updateLimits(request.applyTo(trafficLedger.getLimits()));
    }

    @PostMapping("/traffic/reset")
    public Map<String, Object> resetTraffic(@RequestParam String scope) {
        TrafficResetScope resetScope = TrafficResetScope.parse(scope);
        int removed = trafficLedger.reset(resetScope);
        return Map.of("scope", resetScope, "removed", removed);
    }
}
