package cn.bafuka.tablearmor.intelligent.impl;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.intelligent.CacheAccessType;
import cn.bafuka.tablearmor.intelligent.CacheEvictionPolicy;
import cn.bafuka.tablearmor.intelligent.HotKeyInfo;
import cn.bafuka.tablearmor.intelligent.IntelligentCacheManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 智能缓存管理器默认实现
 *
 * <ul>
 *     <li>访问速率 = 访问次数 / 首次访问至今的分钟数，不足 1 分钟时取访问次数</li>
 *     <li>自适应 TTL = 基础 TTL * min(速率 / 阈值, 2) * max(命中率, 0.5)，并限制在 [minTtl, maxTtl]</li>
 * </ul>
 */
@Slf4j
public class DefaultIntelligentCacheManager implements IntelligentCacheManager {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    /**
     * 每次扫描日志中输出的热点键数量
     */
    private static final int LOGGED_HOT_KEYS = 10;

    private final TableArmorProperties properties;

    private final TableArmorProperties.HotKey hotKeyConfig;

    private final Clock clock;

    private final Map<String, KeyAccessMetrics> keyMetrics = new ConcurrentHashMap<>();

    private final Map<String, TtlMetrics> ttlMetrics = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweepScheduler;

    private ScheduledFuture<?> sweepTask;

    private volatile boolean closed = false;

    public DefaultIntelligentCacheManager(TableArmorProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public DefaultIntelligentCacheManager(TableArmorProperties properties, Clock clock) {
        properties.getHotKey().validate();
        this.properties = properties;
        this.hotKeyConfig = properties.getHotKey();
        this.clock = clock;
        this.sweepScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tablearmor-hotkey-sweep");
            thread.setDaemon(true);
            return thread;
        });
        log.info("智能缓存管理器初始化: threshold={}/min, retention={}", hotKeyConfig.getThreshold(),
                hotKeyConfig.getRetention());
    }

    @Override
    public void recordAccess(String cacheKey, CacheAccessType accessType) {
        if (closed || cacheKey == null || cacheKey.isEmpty() || accessType == null) {
            return;
        }

        long now = clock.millis();
        keyMetrics.compute(cacheKey, (key, existing) -> {
            KeyAccessMetrics metrics = existing != null ? existing : new KeyAccessMetrics(now);
            metrics.recordAccess(now);
            return metrics;
        });

        if (accessType == CacheAccessType.HIT) {
            ttlMetrics.computeIfAbsent(cacheKey, key -> new TtlMetrics()).recordHit();
        } else if (accessType == CacheAccessType.MISS) {
            ttlMetrics.computeIfAbsent(cacheKey, key -> new TtlMetrics()).recordMiss();
        }
    }

    @Override
    public List<HotKeyInfo> getHotKeys(int topN) {
        ensureOpen();
        int limit = Math.min(Math.max(topN, 0), hotKeyConfig.getMaxCandidates());
        if (limit == 0) {
            return Collections.emptyList();
        }

        long now = clock.millis();
        long cutoff = now - hotKeyConfig.getRetention().toMillis();

        List<HotKeyInfo> hotKeys = keyMetrics.entrySet().stream()
                .filter(entry -> entry.getValue().getLastAccessMillis() > cutoff)
                .map(entry -> toHotKeyInfo(entry.getKey(), entry.getValue(), now))
                .sorted(Comparator.comparingDouble(HotKeyInfo::getAccessRate).reversed())
                .limit(limit)
                .collect(Collectors.toList());

        log.debug("获取热点键: count={}", hotKeys.size());
        return hotKeys;
    }

    @Override
    public Duration calculateAdaptiveTtl(String cacheKey) {
        ensureOpen();
        Duration baseTtl = properties.defaultExpiration();
        if (cacheKey == null || cacheKey.isEmpty()) {
            return baseTtl;
        }

        KeyAccessMetrics access = keyMetrics.get(cacheKey);
        TtlMetrics hits = ttlMetrics.get(cacheKey);
        if (access == null || hits == null) {
            return baseTtl;
        }

        double accessRate = accessRate(access, clock.millis());
        double hitRatio = hits.hitRatio();
        double accessWeight = Math.min(accessRate / hotKeyConfig.getThreshold(), 2.0);
        double hitRateWeight = Math.max(hitRatio, 0.5);

        Duration adjusted = Duration.ofMillis((long) (baseTtl.toMillis() * accessWeight * hitRateWeight));
        if (adjusted.compareTo(hotKeyConfig.getMinTtl()) < 0) {
            adjusted = hotKeyConfig.getMinTtl();
        }
        if (adjusted.compareTo(hotKeyConfig.getMaxTtl()) > 0) {
            adjusted = hotKeyConfig.getMaxTtl();
        }

        log.debug("自适应 TTL: key={}, ttl={}, accessRate={}, hitRatio={}", cacheKey, adjusted, accessRate, hitRatio);
        return adjusted;
    }

    @Override
    public double calculateKeyPriority(String cacheKey) {
        ensureOpen();
        if (cacheKey == null || cacheKey.isEmpty()) {
            return 0.0;
        }
        KeyAccessMetrics metrics = keyMetrics.get(cacheKey);
        return metrics == null ? 0.0 : priority(metrics, clock.millis());
    }

    @Override
    public List<String> evictByPolicy(CacheEvictionPolicy policy, int maxItems) {
        ensureOpen();
        if (policy == null || maxItems <= 0) {
            return Collections.emptyList();
        }

        List<String> victims = selectVictims(policy, maxItems);
        for (String key : victims) {
            keyMetrics.remove(key);
            ttlMetrics.remove(key);
        }

        log.info("按策略选择淘汰键: policy={}, count={}", policy, victims.size());
        return victims;
    }

    private List<String> selectVictims(CacheEvictionPolicy policy, int maxItems) {
        long now = clock.millis();
        List<Map.Entry<String, KeyAccessMetrics>> entries = new ArrayList<>(keyMetrics.entrySet());

        switch (policy) {
            case LRU:
                entries.sort(Comparator.comparingLong(entry -> entry.getValue().getLastAccessMillis()));
                break;
            case LFU:
                entries.sort(Comparator.comparingLong(entry -> entry.getValue().getAccessCount()));
                break;
            case FIFO:
                entries.sort(Comparator.comparingLong(entry -> entry.getValue().getFirstAccessMillis()));
                break;
            case TTL:
                long expiration = properties.defaultExpiration().toMillis();
                entries.removeIf(entry -> now - entry.getValue().getLastAccessMillis() <= expiration);
                break;
            case RANDOM:
                Collections.shuffle(entries, ThreadLocalRandom.current());
                break;
            default:
                return Collections.emptyList();
        }

        return entries.stream()
                .limit(maxItems)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    @Override
    public void warmCache(Collection<String> keys) {
        ensureOpen();
        if (keys == null || keys.isEmpty()) {
            return;
        }

        log.info("开始缓存预热: count={}", keys.size());
        for (String key : keys) {
            try {
                recordAccess(key, CacheAccessType.SET);
            } catch (Exception e) {
                log.warn("缓存预热失败: key={}", key, e);
            }
        }
        log.info("缓存预热完成");
    }

    @Override
    public synchronized void startHotKeyDetection() {
        ensureOpen();
        if (sweepTask != null) {
            return;
        }

        long interval = hotKeyConfig.getSweepInterval().toMillis();
        sweepTask = sweepScheduler.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("热点键扫描已启动: interval={}", hotKeyConfig.getSweepInterval());
    }

    @Override
    public synchronized void stopHotKeyDetection() {
        if (sweepTask == null) {
            return;
        }
        sweepTask.cancel(false);
        sweepTask = null;
        log.info("热点键扫描已停止");
    }

    @Override
    public synchronized boolean isHotKeyDetectionActive() {
        return sweepTask != null;
    }

    /**
     * 清理超过保留时间的指标，并输出当前热点键
     */
    void sweep() {
        if (closed) {
            return;
        }

        try {
            long now = clock.millis();
            long cutoff = now - hotKeyConfig.getRetention().toMillis();

            int expired = 0;
            for (Map.Entry<String, KeyAccessMetrics> entry : keyMetrics.entrySet()) {
                if (entry.getValue().getLastAccessMillis() < cutoff
                        && keyMetrics.remove(entry.getKey(), entry.getValue())) {
                    ttlMetrics.remove(entry.getKey());
                    expired++;
                }
            }

            List<String> hot = keyMetrics.entrySet().stream()
                    .filter(entry -> accessRate(entry.getValue(), now) >= hotKeyConfig.getThreshold())
                    .sorted(Comparator.comparingDouble(
                            (Map.Entry<String, KeyAccessMetrics> entry) -> accessRate(entry.getValue(), now)).reversed())
                    .limit(LOGGED_HOT_KEYS)
                    .map(entry -> String.format("%s(%.1f/min)", entry.getKey(), accessRate(entry.getValue(), now)))
                    .collect(Collectors.toList());

            if (!hot.isEmpty()) {
                log.info("检测到热点键: count={}, keys={}", hot.size(), hot);
            }
            log.debug("热点扫描完成: expired={}, hot={}", expired, hot.size());
        } catch (Exception e) {
            log.error("热点扫描失败", e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        stopHotKeyDetection();
        closed = true;
        sweepScheduler.shutdown();
        try {
            if (!sweepScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        keyMetrics.clear();
        ttlMetrics.clear();
        log.info("智能缓存管理器已关闭");
    }

    /**
     * 当前追踪的键数量
     */
    public int getTrackedKeyCount() {
        return keyMetrics.size();
    }

    private HotKeyInfo toHotKeyInfo(String key, KeyAccessMetrics metrics, long now) {
        return HotKeyInfo.builder()
                .key(key)
                .accessCount(metrics.getAccessCount())
                .accessRate(accessRate(metrics, now))
                .firstAccess(Instant.ofEpochMilli(metrics.getFirstAccessMillis()))
                .lastAccess(Instant.ofEpochMilli(metrics.getLastAccessMillis()))
                .averageInterval(averageInterval(metrics))
                .priority(priority(metrics, now))
                .build();
    }

    private static double accessRate(KeyAccessMetrics metrics, long now) {
        double minutes = (double) (now - metrics.getFirstAccessMillis()) / MILLIS_PER_MINUTE;
        if (minutes < 1.0) {
            return metrics.getAccessCount();
        }
        return metrics.getAccessCount() / minutes;
    }

    private static Duration averageInterval(KeyAccessMetrics metrics) {
        long count = metrics.getAccessCount();
        if (count <= 1) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((metrics.getLastAccessMillis() - metrics.getFirstAccessMillis()) / (count - 1));
    }

    private static double priority(KeyAccessMetrics metrics, long now) {
        double minutesSinceLast = (double) (now - metrics.getLastAccessMillis()) / MILLIS_PER_MINUTE;
        double recencyScore = Math.max(0.0, 60.0 - minutesSinceLast) / 60.0;
        return 0.7 * accessRate(metrics, now) + 0.3 * recencyScore;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IntelligentCacheManager is closed");
        }
    }
}
