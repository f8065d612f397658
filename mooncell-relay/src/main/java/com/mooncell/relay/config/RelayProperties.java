package com.mooncell.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * relay.* 启动参数，运行期只读
 */
@Data
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private int workers = 3;
    private int queueCapacity = 500;
    private String stagingDir = System.getProperty("java.io.tmpdir") + "/mooncell-relay";
    private Duration finishedTaskTtl = Duration.ofHours(1);

    private RateLimiter rateLimiter = new RateLimiter();
    private Retry retry = new Retry();
    private Timeouts timeouts = new Timeouts();
    private Batch batch = new Batch();
    private Session session = new Session();
    private Traffic traffic = new Traffic();

    @Data
    public static class RateLimiter {
        private double capacity = 3.0;
        private double initialRate = 0.5;
        private double minRate = 0.1;
        private double maxRate = 10.0;
        private int successThreshold = 10;
        private double increaseFactor = 1.2;
        private double decreaseFactor = 0.5;
    }

    @Data
    public static class Retry {
        // 限流 / 超时 / 断线导致的整任务重试上限
        private int maxAttempts = 3;
        // 令牌不足时的延后次数上限
        private int maxDeferrals = 100;
        private Duration minDelay = Duration.ofMillis(500);
        private Duration defaultBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Timeouts {
        private Duration fetch = Duration.ofSeconds(60);
        private Duration deliver = Duration.ofMinutes(5);
    }

    @Data
    public static class Batch {
        private int maxSize = 100;
        private int window = 5;
        private Duration resubmitDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Session {
        private String generalIdentity = "bot";
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration reconnectInterval = Duration.ofSeconds(30);
        private int maxReconnectFailures = 5;
    }

    @Data
    public static class Traffic {
        private boolean enabled = true;
        private long perFileLimit = 100L * 1024 * 1024;
        private long dailyLimit = 1024L * 1024 * 1024;
        private long monthlyLimit = 10L * 1024 * 1024 * 1024;
    }
}
