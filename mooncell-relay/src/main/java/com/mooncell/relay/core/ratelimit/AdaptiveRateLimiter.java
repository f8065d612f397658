package com.mooncell.relay.core.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import com.mooncell.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 自适应令牌桶。所有 worker 共享一个实例，
 * 补充令牌与扣减判断在同一把锁内完成，避免基于过期读数重复扣减。
 *
 * <p>上游返回限流信号时速率减半，连续成功达到阈值后速率上调，
 * 速率始终落在 [minRate, maxRate]，令牌数始终落在 [0, capacity]。
 */
@Slf4j
public class AdaptiveRateLimiter {

    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final Ticker ticker;
    private final double capacity;
    private final double minRate;
    private final double maxRate;
    private final int successThreshold;
    private final double increaseFactor;
    private final double decreaseFactor;

    private double tokens;
    private double rate;
    private long lastRefill;
    private int consecutiveSuccesses;
    private long cooldownUntil;

    public AdaptiveRateLimiter(RelayProperties.RateLimiter config, Ticker ticker) {
        if (config.getCapacity() <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (config.getMinRate() <= 0 || config.getMinRate() > config.getMaxRate()) {
            throw new IllegalArgumentException("invalid rate bounds [" + config.getMinRate() + ", " + config.getMaxRate() + "]");
        }
        this.ticker = ticker;
        this.capacity = config.getCapacity();
        this.minRate = config.getMinRate();
        this.maxRate = config.getMaxRate();
        this.successThreshold = Math.max(1, config.getSuccessThreshold());
        this.increaseFactor = config.getIncreaseFactor();
        this.decreaseFactor = config.getDecreaseFactor();
        this.rate = clamp(config.getInitialRate());
        this.tokens = capacity;
        this.lastRefill = ticker.read();
        this.cooldownUntil = lastRefill;
    }

    public boolean tryAcquire() {
        return tryAcquire(1.0);
    }

    public synchronized boolean tryAcquire(double cost) {
        refill();
        if (tokens >= cost) {
            tokens -= cost;
            return true;
        }
        return false;
    }

    /**
     * 上游要求强制等待：速率减半并记录冷却期
     */
    public synchronized void onThrottled(Duration waitHint) {
        refill();
        double previous = rate;
        rate = clamp(rate * decreaseFactor);
        consecutiveSuccesses = 0;
        if (waitHint != null && !waitHint.isNegative()) {
            cooldownUntil = Math.max(cooldownUntil, ticker.read() + waitHint.toNanos());
        }
        log.warn("Upstream throttled (wait {}), rate {} -> {}/s", waitHint, previous, rate);
    }

    public synchronized void onSuccess() {
        consecutiveSuccesses++;
        if (consecutiveSuccesses >= successThreshold) {
            refill();
            double previous = rate;
            rate = clamp(rate * increaseFactor);
            consecutiveSuccesses = 0;
            if (previous != rate) {
                log.debug("Rate raised {} -> {}/s", previous, rate);
            }
        }
    }

    public synchronized Duration cooldownRemaining() {
        long remaining = cooldownUntil - ticker.read();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    /**
     * 以当前速率攒够 cost 个令牌还需要多久
     */
    public synchronized Duration estimateWait(double cost) {
        refill();
        if (tokens >= cost) {
            return Duration.ZERO;
        }
        double seconds = (cost - tokens) / rate;
        return Duration.ofNanos((long) Math.ceil(seconds * NANOS_PER_SECOND));
    }

    public synchronized RateLimiterSnapshot snapshot() {
        refill();
        return new RateLimiterSnapshot(capacity, tokens, rate, minRate, maxRate, consecutiveSuccesses);
    }

    private void refill() {
        long now = ticker.read();
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * rate);
            lastRefill = now;
        }
    }

    private double clamp(double value) {
        return Math.max(minRate, Math.min(maxRate, value));
    }
}
