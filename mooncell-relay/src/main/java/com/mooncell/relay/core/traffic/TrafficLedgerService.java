package com.mooncell.relay.core.traffic;

import com.mooncell.relay.config.RelayProperties;
import com.mooncell.relay.core.dao.TrafficMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认流量账本：已完成的用量落库，进行中的预留只保存在内存中。
 * 同一用户的检查与预留在 compute 内完成，天然串行。
 *
 * <p>限制可以在运行时修改，修改后落库，重启后仍然生效。
 */
@Slf4j
@Service
public class TrafficLedgerService implements TrafficLedger {

    private final TrafficMapper trafficMapper;
    private final Clock clock;

    private volatile TrafficLimits limits;

    // userId -> 已预留未结算的字节数
    private final Map<String, Long> reservations = new ConcurrentHashMap<>();

    public TrafficLedgerService(TrafficMapper trafficMapper, RelayProperties properties, Clock clock) {
        this.trafficMapper = trafficMapper;
        this.limits = TrafficLimits.from(properties.getTraffic());
        this.clock = clock;
    }

    @PostConstruct
    public void loadLimits() {
        TrafficLimits stored = trafficMapper.findLimits();
        if (stored != null) {
            limits = stored;
            log.info("Traffic limits loaded from database: {}", stored);
        }
    }

    @Override
    public QuotaDecision checkAndReserve(String userId, long byteSize) {
        TrafficLimits current = limits;
        if (!current.isEnabled()) {
            reservations.merge(userId, byteSize, Long::sum);
            return QuotaDecision.allowed();
        }
        if (byteSize > current.getPerFileLimit()) {
            log.info("User {} rejected: {} bytes exceeds per-file limit", userId, byteSize);
            return QuotaDecision.exceeded(LimitKind.PER_FILE);
        }

        QuotaDecision[] decision = new QuotaDecision[1];
        reservations.compute(userId, (k, reserved) -> {
            long pending = reserved == null ? 0 : reserved;
            long daily = trafficMapper.sumSince(userId, dayStart()) + pending;
            if (daily + byteSize > current.getDailyLimit()) {
                decision[0] = QuotaDecision.exceeded(LimitKind.DAILY);
                return reserved;
            }
            long monthly = trafficMapper.sumSince(userId, monthStart()) + pending;
            if (monthly + byteSize > current.getMonthlyLimit()) {
                decision[0] = QuotaDecision.exceeded(LimitKind.MONTHLY);
                return reserved;
            }
            decision[0] = QuotaDecision.allowed();
            return pending + byteSize;
        });

        if (!decision[0].isAllowed()) {
            log.info("User {} rejected: {} limit reached", userId, decision[0].getExceededLimit());
        }
        return decision[0];
    }

    @Override
    public void record(String userId, long byteSize, TrafficOutcome outcome) {
        // 落库与释放预留放在同一个 compute 内，避免中间窗口被并发预留重复使用
        reservations.compute(userId, (k, reserved) -> {
            if (outcome == TrafficOutcome.SUCCEEDED) {
                persistUsage(userId, byteSize);
            }
            long left = (reserved == null ? 0 : reserved) - byteSize;
            return left > 0 ? left : null;
        });
    }

    // 落库失败不影响已完成的投递，也不能让预留泄漏
    private void persistUsage(String userId, long byteSize) {
        try {
            trafficMapper.insert(userId, byteSize, Instant.now(clock));
        } catch (RuntimeException e) {
            log.error("Failed to persist {} bytes of traffic for {}, usage is not counted", byteSize, userId, e);
        }
    }

    public long reservedBytes(String userId) {
        return reservations.getOrDefault(userId, 0L);
    }

    public TrafficLimits getLimits() {
        return limits;
    }

    public TrafficUsage usage(String userId) {
        return new TrafficUsage(userId,
                trafficMapper.sumSince(userId, dayStart()),
                trafficMapper.sumSince(userId, monthStart()),
                trafficMapper.sumTotal(userId),
                reservedBytes(userId));
    }

    public TrafficUsage totalUsage() {
        long reserved = reservations.values().stream().mapToLong(Long::longValue).sum();
        return new TrafficUsage(null,
                trafficMapper.sumAllSince(dayStart()),
                trafficMapper.sumAllSince(monthStart()),
                trafficMapper.sumAll(),
                reserved);
    }

    /**
     * 替换当前限制并落库，之后的检查立即按新限制进行；已预留的额度不受影响
     */
    public TrafficLimits updateLimits(TrafficLimits updated) {
        if (updated.getPerFileLimit() < 0 || updated.getDailyLimit() < 0 || updated.getMonthlyLimit() < 0) {
            throw new IllegalArgumentException("Traffic limits must not be negative");
        }
        synchronized (this) {
            trafficMapper.saveLimits(updated, Instant.now(clock));
            limits = updated;
        }
        log.info("Traffic limits changed to {}", updated);
        return updated;
    }

    /**
     * 清除指定范围内已结算的用量，返回删除的记录数
     */
    public int reset(TrafficResetScope scope) {
        int removed;
        switch (scope) {
            case DAILY:
                removed = trafficMapper.deleteSince(dayStart());
                break;
            case MONTHLY:
                removed = trafficMapper.deleteSince(monthStart());
                break;
            default:
                removed = trafficMapper.deleteAll();
                break;
        }
        log.info("Traffic usage reset ({}): {} records removed", scope, removed);
        return removed;
    }

    private Instant dayStart() {
        ZoneId zone = clock.getZone();
        return LocalDate.now(clock).atStartOfDay(zone).toInstant();
    }

    private Instant monthStart() {
        ZoneId zone = clock.getZone();
        return LocalDate.now(clock).withDayOfMonth(1).atStartOfDay(zone).toInstant();
    }
}
