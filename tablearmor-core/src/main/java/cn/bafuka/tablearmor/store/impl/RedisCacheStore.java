package cn.bafuka.tablearmor.store.impl;

import cn.bafuka.tablearmor.exception.TableArmorException;
import cn.bafuka.tablearmor.store.CacheStore;
import cn.bafuka.tablearmor.store.GlobPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.RedisSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Redis 缓存存储实现
 * 基于 RedisTemplate，按模式删除使用 SCAN 而不是 KEYS
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    /**
     * 每批 SCAN 的提示数量
     */
    private static final long SCAN_COUNT = 1000;

    /**
     * Redis 模板
     */
    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * 未指定 TTL 时使用的过期时间
     */
    private final Duration defaultTtl;

    public RedisCacheStore(RedisTemplate<String, Object> redisTemplate, Duration defaultTtl) {
        this.redisTemplate = redisTemplate;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Object get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            throw backendError("从 Redis 获取数据失败: key=" + key, e);
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null) {
            return;
        }

        Duration effective = ttl != null ? ttl : defaultTtl;
        try {
            redisTemplate.opsForValue().set(key, value, effective.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("写入 Redis: key={}, ttl={}", key, effective);
        } catch (Exception e) {
            throw backendError("写入 Redis 失败: key=" + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redisTemplate.delete(key);
        } catch (Exception e) {
            throw backendError("从 Redis 删除失败: key=" + key, e);
        }
    }

    @Override
    public long removeByPattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return 0;
        }

        try {
            List<String> keys = scanKeys(GlobPatterns.toRedisPattern(pattern));
            if (keys.isEmpty()) {
                return 0;
            }

            Long deleted = redisTemplate.delete(keys);
            log.debug("Redis 按模式删除: pattern={}, matched={}, deleted={}", pattern, keys.size(), deleted);
            return deleted == null ? 0 : deleted;
        } catch (Exception e) {
            throw backendError("Redis 按模式删除失败: pattern=" + pattern, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (Exception e) {
            throw backendError("检查 Redis 键失败: key=" + key, e);
        }
    }

    @SuppressWarnings("unchecked")
    private List<String> scanKeys(String redisPattern) {
        RedisSerializer<String> keySerializer = (RedisSerializer<String>) redisTemplate.getKeySerializer();
        ScanOptions options = ScanOptions.scanOptions().match(redisPattern).count(SCAN_COUNT).build();

        List<String> keys = redisTemplate.execute((RedisCallback<List<String>>) connection -> {
            List<String> matched = new ArrayList<>();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    matched.add(keySerializer.deserialize(cursor.next()));
                }
            }
            return matched;
        });
        return keys == null ? Collections.<String>emptyList() : keys;
    }

    private TableArmorException backendError(String message, Exception cause) {
        return new TableArmorException(message, cause, TableArmorException.ErrorKind.BACKEND);
    }
}
