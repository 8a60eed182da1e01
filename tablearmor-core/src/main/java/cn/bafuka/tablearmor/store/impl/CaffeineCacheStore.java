package cn.bafuka.tablearmor.store.impl;

import cn.bafuka.tablearmor.store.CacheStore;
import cn.bafuka.tablearmor.store.GlobPatterns;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 本地缓存存储实现
 * 基于 Caffeine，每个条目携带自己的过期时间
 */
@Slf4j
public class CaffeineCacheStore implements CacheStore {

    /**
     * 默认最大容量
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 100_000;

    private final Cache<String, ExpiringValue> cache;

    /**
     * 未指定 TTL 时使用的过期时间
     */
    private final Duration defaultTtl;

    public CaffeineCacheStore(Duration defaultTtl) {
        this(DEFAULT_MAXIMUM_SIZE, defaultTtl);
    }

    public CaffeineCacheStore(long maximumSize, Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .build();

        log.info("构建本地缓存存储，配置: maximumSize={}, defaultTtl={}", maximumSize, defaultTtl);
    }

    @Override
    public Object get(String key) {
        if (key == null) {
            return null;
        }
        ExpiringValue entry = cache.getIfPresent(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }
        Duration effective = ttl != null ? ttl : defaultTtl;
        cache.put(key, new ExpiringValue(value, effective.toNanos()));
        log.debug("本地缓存写入: key={}, ttl={}", key, effective);
    }

    @Override
    public void remove(String key) {
        if (key == null) {
            return;
        }
        cache.invalidate(key);
    }

    @Override
    public long removeByPattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return 0;
        }

        Pattern regex = GlobPatterns.toRegex(pattern);
        List<String> matched = cache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toList());

        cache.invalidateAll(matched);
        log.debug("本地缓存按模式删除: pattern={}, count={}", pattern, matched.size());
        return matched.size();
    }

    @Override
    public boolean exists(String key) {
        return key != null && cache.getIfPresent(key) != null;
    }

    /**
     * 带过期时间的值
     */
    private static final class ExpiringValue {
        private final Object value;
        private final long ttlNanos;

        private ExpiringValue(Object value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    /**
     * 按条目计算过期时间，读操作不续期
     */
    private static final class PerEntryExpiry implements Expiry<String, ExpiringValue> {

        @Override
        public long expireAfterCreate(String key, ExpiringValue value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, ExpiringValue value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, ExpiringValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
