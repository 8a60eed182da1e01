package cn.bafuka.tablearmor.config;

import cn.bafuka.tablearmor.model.InvalidationRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * TableArmor 配置属性
 * 从 application.yml 读取配置，构造阶段调用 {@link #validate()} 快速失败
 */
@Data
@ConfigurationProperties(prefix = "tablearmor")
public class TableArmorProperties {

    /**
     * 是否启用 TableArmor
     */
    private boolean enabled = true;

    /**
     * 命名空间（区分应用与环境）
     */
    private String namespace = "TableArmor";

    /**
     * 版本键，可为空
     */
    private String versionKey;

    /**
     * 键分隔符
     */
    private String keySeparator = "_";

    /**
     * 表追踪键前缀
     */
    private String trackingPrefix = "table";

    /**
     * 默认缓存过期时间（分钟）
     */
    private int defaultExpirationMinutes = 30;

    /**
     * 连锁失效的最大深度
     */
    private int maxRelatedDepth = 3;

    /**
     * 分布式失效配置
     */
    private Distributed distributed = new Distributed();

    /**
     * 错误处理配置
     */
    private ErrorHandling errorHandling = new ErrorHandling();

    /**
     * 熔断器配置
     */
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    /**
     * 热点键与自适应 TTL 配置
     */
    private HotKey hotKey = new HotKey();

    /**
     * 日志开关
     */
    private Logging logging = new Logging();

    /**
     * 表级失效策略
     */
    private List<InvalidationRule> tablePolicies = new ArrayList<>();

    /**
     * 默认过期时间
     *
     * @return 过期时长
     */
    public Duration defaultExpiration() {
        return Duration.ofMinutes(defaultExpirationMinutes);
    }

    /**
     * 按表名查找失效策略
     *
     * @param tableName 表名
     * @return 策略，不存在返回 null
     */
    public InvalidationRule findTablePolicy(String tableName) {
        if (tableName == null || tablePolicies == null) {
            return null;
        }
        for (InvalidationRule rule : tablePolicies) {
            if (rule != null && tableName.equals(rule.getTableName())) {
                return rule;
            }
        }
        return null;
    }

    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 配置无效时
     */
    public void validate() {
        if (keySeparator == null || keySeparator.isEmpty()) {
            throw new IllegalArgumentException("keySeparator cannot be null or empty");
        }

        if (trackingPrefix == null || trackingPrefix.trim().isEmpty()) {
            throw new IllegalArgumentException("trackingPrefix cannot be null or empty");
        }

        if (defaultExpirationMinutes <= 0) {
            throw new IllegalArgumentException(
                    String.format("defaultExpirationMinutes must be positive, got: %d", defaultExpirationMinutes));
        }

        if (maxRelatedDepth <= 0) {
            throw new IllegalArgumentException(
                    String.format("maxRelatedDepth must be positive, got: %d", maxRelatedDepth));
        }

        circuitBreaker.validate();
        hotKey.validate();

        if (tablePolicies != null) {
            for (InvalidationRule rule : tablePolicies) {
                if (rule == null) {
                    throw new IllegalArgumentException("Table policy cannot be null");
                }
                rule.validate();
            }
        }
    }

    /**
     * 分布式失效配置
     */
    @Data
    public static class Distributed {
        /**
         * 是否启用分布式失效广播
         */
        private boolean enabled = false;

        /**
         * 广播传输方式
         */
        private Transport transport = Transport.REDIS;

        /**
         * 去重窗口内保留的 correlationId 数量
         */
        private long dedupCapacity = 10_000;

        /**
         * 去重窗口
         */
        private Duration dedupWindow = Duration.ofMinutes(5);
    }

    /**
     * 广播传输方式
     */
    public enum Transport {
        /**
         * Spring Data Redis Pub/Sub
         */
        REDIS,

        /**
         * Redisson RTopic
         */
        REDISSON,

        /**
         * 进程内总线（单节点）
         */
        LOCAL
    }

    /**
     * 错误处理配置
     */
    @Data
    public static class ErrorHandling {
        /**
         * 缓存错误时静默降级（绕过缓存）
         */
        private boolean silentFallback = true;
    }

    /**
     * 熔断器配置
     */
    @Data
    public static class CircuitBreaker {
        /**
         * 是否启用熔断器
         */
        private boolean enabled = true;

        /**
         * 打开熔断器的失败阈值
         */
        private int failureThreshold = 5;

        /**
         * OPEN 转为 HALF_OPEN 的等待时间
         */
        private Duration timeout = Duration.ofMinutes(1);

        /**
         * 健康检查周期
         */
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        /**
         * 操作指标保留时间
         */
        private Duration metricRetention = Duration.ofHours(1);

        public void validate() {
            if (failureThreshold <= 0) {
                throw new IllegalArgumentException(
                        String.format("circuitBreaker.failureThreshold must be positive, got: %d", failureThreshold));
            }
            requirePositive("circuitBreaker.timeout", timeout);
            requirePositive("circuitBreaker.healthCheckInterval", healthCheckInterval);
            requirePositive("circuitBreaker.metricRetention", metricRetention);
        }
    }

    /**
     * 热点键与自适应 TTL 配置
     */
    @Data
    public static class HotKey {
        /**
         * 是否启用智能缓存管理
         */
        private boolean enabled = true;

        /**
         * 热点阈值（次/分钟）
         */
        private double threshold = 10.0;

        /**
         * 指标保留时间
         */
        private Duration retention = Duration.ofHours(24);

        /**
         * 热点候选上限
         */
        private int maxCandidates = 100;

        /**
         * 热点扫描周期
         */
        private Duration sweepInterval = Duration.ofMinutes(1);

        /**
         * 自适应 TTL 下限
         */
        private Duration minTtl = Duration.ofMinutes(5);

        /**
         * 自适应 TTL 上限
         */
        private Duration maxTtl = Duration.ofHours(24);

        public void validate() {
            if (threshold <= 0) {
                throw new IllegalArgumentException(
                        String.format("hotKey.threshold must be positive, got: %.2f", threshold));
            }
            if (maxCandidates <= 0) {
                throw new IllegalArgumentException(
                        String.format("hotKey.maxCandidates must be positive, got: %d", maxCandidates));
            }
            requirePositive("hotKey.retention", retention);
            requirePositive("hotKey.sweepInterval", sweepInterval);
            requirePositive("hotKey.minTtl", minTtl);
            requirePositive("hotKey.maxTtl", maxTtl);
            if (maxTtl.compareTo(minTtl) < 0) {
                throw new IllegalArgumentException(
                        String.format("hotKey.maxTtl (%s) must not be less than hotKey.minTtl (%s)", maxTtl, minTtl));
            }
        }
    }

    /**
     * 日志开关
     */
    @Data
    public static class Logging {
        /**
         * 记录命中/未命中
         */
        private boolean logCacheHitMiss = true;

        /**
         * 记录失效
         */
        private boolean logInvalidation = true;

        /**
         * 记录键生成
         */
        private boolean logKeyGeneration = false;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(
                    String.format("%s must be a positive duration, got: %s", name, value));
        }
    }
}
