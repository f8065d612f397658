package com.mooncell.relay.core.download;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.model.FailureReason;
import com.mooncell.relay.core.model.RelayTask;
import com.mooncell.relay.core.model.SourceReference;
import com.mooncell.relay.core.network.DeliveryPath;
import com.mooncell.relay.core.network.DeliveryReceipt;
import com.mooncell.relay.core.network.FetchedContent;
import com.mooncell.relay.core.network.SourceNetworkClient;
import com.mooncell.relay.core.network.UpstreamException;
import com.mooncell.relay.core.ratelimit.AdaptiveRateLimiter;
import com.mooncell.relay.core.session.CapabilityException;
import com.mooncell.relay.core.session.ClientHandle;
import com.mooncell.relay.core.session.ClientPool;
import com.mooncell.relay.core.task.Disposition;
import com.mooncell.relay.core.traffic.QuotaDecision;
import com.mooncell.relay.core.traffic.TrafficLedger;
import com.mooncell.relay.core.traffic.TrafficOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 单个任务的完整流水线：
 * 解析链接 -> 获取会话 -> 令牌桶 -> 拉取 -> 额度检查 -> 投递 -> 清理。
 *
 * <p>限流、超时、会话断线属于可恢复错误，只会让任务延迟后重新入队（有次数上限）；
 * 其余错误直接成为任务的失败原因。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadOrchestrator {

    private final ReferenceResolver resolver;
    private final ClientPool clientPool;
    private final AdaptiveRateLimiter rateLimiter;
    private final SourceNetworkClient network;
    private final TrafficLedger trafficLedger;
    private final StagingArea stagingArea;
    private final RelayProperties properties;

    public Disposition execute(RelayTask task) {
        if (task.isCancelRequested()) {
            return cancelled(task, "resolve");
        }

        // 1. 解析
        SourceReference reference = task.getReference();
        if (reference == null) {
            try {
                reference = resolver.resolve(task.getLink());
            } catch (InvalidReferenceException e) {
                return fail(task, FailureReason.INVALID_REFERENCE, e.getMessage());
            }
            task.setReference(reference);
        }

        // 2. 按能力获取会话，缺少特权会话直接拒绝，不做任何网络调用
        ClientHandle handle;
        try {
            handle = clientPool.acquire(reference.requiredCapability(), task.getRequester());
        } catch (CapabilityException e) {
            if (e.getReason() == CapabilityException.Reason.NO_PRIVILEGED_SESSION) {
                return fail(task, FailureReason.ACCESS_DENIED, e.getMessage());
            }
            return retryLater(task, properties.getRetry().getDefaultBackoff(), e.getMessage());
        }

        try {
            return runWithHandle(task, reference, handle);
        } finally {
            clientPool.release(handle);
        }
    }

    private Disposition runWithHandle(RelayTask task, SourceReference reference, ClientHandle handle) {
        // 3. 令牌桶：拿不到令牌就延迟重新入队，不占着 worker 等待
        Duration cooldown = rateLimiter.cooldownRemaining();
        if (!cooldown.isZero() || !rateLimiter.tryAcquire()) {
            Duration wait = longest(cooldown, rateLimiter.estimateWait(1.0), properties.getRetry().getMinDelay());
            return defer(task, wait);
        }
        if (task.isCancelRequested()) {
            return cancelled(task, "fetch");
        }

        try (StagingArea.Staged staged = stagingArea.allocate(task.getId())) {
            // 4. 拉取
            FetchedContent content;
            try {
                content = fetch(reference, handle, staged.path());
            } catch (UpstreamException e) {
                return onFetchFailed(task, handle, e);
            }
            long size = content.getSizeBytes();
            task.setByteSize(size);

            if (task.isCancelRequested()) {
                return cancelled(task, "quota check");
            }

            // 5. 额度
            QuotaDecision decision = trafficLedger.checkAndReserve(task.getRequester(), size);
            if (!decision.isAllowed()) {
                return fail(task, FailureReason.QUOTA_EXCEEDED, decision.getExceededLimit().name());
            }

            // 6. 投递
            TrafficOutcome outcome = TrafficOutcome.FAILED;
            try {
                if (task.isCancelRequested()) {
                    return cancelled(task, "delivery");
                }
                DeliveryAttempt attempt = deliver(content, task.getRequester(), handle);
                if (!attempt.isSuccess()) {
                    return onDeliveryFailed(task, attempt.getError());
                }
                outcome = TrafficOutcome.SUCCEEDED;
                log.info("Task {} relayed {} ({} bytes) via {}", task.getId(), reference, size, attempt.getPath());
            } finally {
                trafficLedger.record(task.getRequester(), size, outcome);
            }

            rateLimiter.onSuccess();
            task.succeed(size);
            return Disposition.done();
        }
    }

    private FetchedContent fetch(SourceReference reference, ClientHandle handle, Path stagingFile) {
        Duration limit = properties.getTimeouts().getFetch();
        try {
            return network.fetch(reference, handle, stagingFile)
                    .timeout(limit, Mono.error(() -> UpstreamException.timeout("fetch", limit)))
                    .blockOptional()
                    .orElseThrow(() -> new UpstreamException(UpstreamException.Kind.NOT_FOUND, "Message " + reference + " is empty"));
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException(UpstreamException.Kind.OTHER, "fetch failed: " + e.getMessage(), e);
        }
    }

    private Disposition onFetchFailed(RelayTask task, ClientHandle handle, UpstreamException e) {
        switch (e.getKind()) {
            case THROTTLED:
                rateLimiter.onThrottled(e.getWaitHint());
                Duration hint = e.getWaitHint() == null ? properties.getRetry().getDefaultBackoff() : e.getWaitHint();
                return retryLater(task, hint, e.getMessage());
            case TIMEOUT:
                // 超时按限流处理
                rateLimiter.onThrottled(null);
                return retryLater(task, properties.getRetry().getDefaultBackoff(), e.getMessage());
            case DISCONNECTED:
                clientPool.markDegraded(handle, e.getMessage());
                return retryLater(task, properties.getRetry().getDefaultBackoff(), e.getMessage());
            case NOT_FOUND:
                return fail(task, FailureReason.NOT_FOUND, e.getMessage());
            case ACCESS_DENIED:
                return fail(task, FailureReason.ACCESS_DENIED, e.getMessage());
            default:
                return fail(task, FailureReason.UPSTREAM_ERROR, e.getMessage());
        }
    }

    /**
     * 最后一次投递仍是限流或超时，整任务走有上限的重试；其余错误（含文件过大）直接失败
     */
    private Disposition onDeliveryFailed(RelayTask task, UpstreamException e) {
        switch (e.getKind()) {
            case THROTTLED:
                Duration hint = e.getWaitHint() == null ? properties.getRetry().getDefaultBackoff() : e.getWaitHint();
                return retryLater(task, hint, e.getMessage());
            case TIMEOUT:
                return retryLater(task, properties.getRetry().getDefaultBackoff(), e.getMessage());
            default:
                return fail(task, FailureReason.DELIVERY_FAILED, e.getMessage());
        }
    }

    /**
     * 先走主路径；仅当失败原因是文件过大或临时性错误时，再尝试一次备用路径
     */
    private DeliveryAttempt deliver(FetchedContent content, String target, ClientHandle handle) {
        DeliveryAttempt primary = attemptDelivery(content, target, handle, DeliveryPath.PRIMARY);
        if (primary.isSuccess() || !primary.getError().getKind().allowsFallback()) {
            return primary;
        }
        log.warn("Primary delivery to {} failed ({}), trying fallback", target, primary.getError().getMessage());
        return attemptDelivery(content, target, handle, DeliveryPath.FALLBACK);
    }

    private DeliveryAttempt attemptDelivery(FetchedContent content, String target, ClientHandle handle, DeliveryPath path) {
        Duration limit = properties.getTimeouts().getDeliver();
        try {
            DeliveryReceipt receipt = network.deliver(content, target, handle, path)
                    .timeout(limit, Mono.error(() -> UpstreamException.timeout("deliver", limit)))
                    .block();
            return DeliveryAttempt.succeeded(path, receipt);
        } catch (UpstreamException e) {
            if (e.getKind() == UpstreamException.Kind.THROTTLED) {
                rateLimiter.onThrottled(e.getWaitHint());
            } else if (e.getKind() == UpstreamException.Kind.TIMEOUT) {
                // 与拉取一致，投递超时按限流处理
                rateLimiter.onThrottled(null);
            }
            return DeliveryAttempt.failed(path, e);
        } catch (RuntimeException e) {
            return DeliveryAttempt.failed(path, new UpstreamException(UpstreamException.Kind.OTHER, e.getMessage(), e));
        }
    }

    private Disposition retryLater(RelayTask task, Duration delay, String cause) {
        int attempts = task.incrementAttempts();
        int max = properties.getRetry().getMaxAttempts();
        if (attempts > max) {
            return fail(task, FailureReason.RETRIES_EXHAUSTED, cause + " (gave up after " + max + " retries)");
        }
        log.info("Task {} retry {}/{} in {}: {}", task.getId(), attempts, max, delay, cause);
        return Disposition.requeue(delay);
    }

    private Disposition defer(RelayTask task, Duration wait) {
        int deferrals = task.incrementDeferrals();
        if (deferrals > properties.getRetry().getMaxDeferrals()) {
            return fail(task, FailureReason.RETRIES_EXHAUSTED, "rate limit not available after " + (deferrals - 1) + " deferrals");
        }
        log.debug("Task {} rate limited, deferred {}", task.getId(), wait);
        return Disposition.requeue(wait);
    }

    private Disposition cancelled(RelayTask task, String stage) {
        return fail(task, FailureReason.CANCELLED, "Cancelled before " + stage);
    }

    private Disposition fail(RelayTask task, FailureReason reason, String detail) {
        if (task.fail(reason, detail)) {
            log.warn("Task {} failed: {} - {}", task.getId(), reason, detail);
        }
        return Disposition.done();
    }

    private static Duration longest(Duration a, Duration b, Duration c) {
        Duration max = a.compareTo(b) >= 0 ? a : b;
        return max.compareTo(c) >= 0 ? max : c;
    }
}
