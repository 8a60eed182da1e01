package cn.bafuka.tablearmor.core;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.exception.TableArmorException;
import cn.bafuka.tablearmor.intelligent.CacheAccessType;
import cn.bafuka.tablearmor.intelligent.CacheEvictionPolicy;
import cn.bafuka.tablearmor.intelligent.IntelligentCacheManager;
import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.keygen.CacheKeyGenerator;
import cn.bafuka.tablearmor.model.InvalidationResult;
import cn.bafuka.tablearmor.model.InvalidationRule;
import cn.bafuka.tablearmor.resilience.CacheCircuitBreaker;
import cn.bafuka.tablearmor.store.CacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * TableArmor 缓存门面
 * 上游调用方（请求拦截层）只通过这里使用引擎：生成键、经熔断器读写存储、追踪表依赖、按表失效
 *
 * 熔断器与智能缓存管理器都是可选的，缺失时直接访问存储、使用默认 TTL
 */
@Slf4j
public class TableArmorCache {

    private static final String OP_GET = "cache.get";
    private static final String OP_SET = "cache.set";
    private static final String OP_REMOVE = "cache.remove";

    private final TableArmorProperties properties;

    private final CacheStore cacheStore;

    private final CacheKeyGenerator keyGenerator;

    /**
     * 本地或分布式失效器
     */
    private final CacheInvalidator invalidator;

    private final Optional<CacheCircuitBreaker> circuitBreaker;

    private final Optional<IntelligentCacheManager> intelligentManager;

    public TableArmorCache(TableArmorProperties properties,
                           CacheStore cacheStore,
                           CacheKeyGenerator keyGenerator,
                           CacheInvalidator invalidator,
                           CacheCircuitBreaker circuitBreaker,
                           IntelligentCacheManager intelligentManager) {
        this.properties = properties;
        this.cacheStore = cacheStore;
        this.keyGenerator = keyGenerator;
        this.invalidator = invalidator;
        this.circuitBreaker = Optional.ofNullable(circuitBreaker);
        this.intelligentManager = Optional.ofNullable(intelligentManager);
    }

    public String generateKey(String operationId, String action, Map<String, ?> parameters) {
        return keyGenerator.generateKey(operationId, action, parameters);
    }

    /**
     * 读取缓存
     *
     * @param key 缓存键
     * @return 缓存值，未命中或降级时返回 null
     */
    public Object get(String key) {
        Object value = guarded(OP_GET, () -> cacheStore.get(key));

        boolean hit = value != null;
        recordAccess(key, hit ? CacheAccessType.HIT : CacheAccessType.MISS);
        if (properties.getLogging().isLogCacheHitMiss()) {
            log.debug("缓存{}: key={}", hit ? "命中" : "未命中", key);
        }
        return value;
    }

    /**
     * 读取缓存并转换类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            log.warn("缓存值类型不匹配，按未命中处理: key={}, expected={}, actual={}",
                    key, type.getName(), value.getClass().getName());
            return null;
        }
        return (T) value;
    }

    /**
     * 写入缓存并追踪表依赖，TTL 由智能缓存管理器计算
     */
    public void put(String key, Object value, Collection<String> tables) {
        Duration ttl = intelligentManager
                .map(manager -> safeAdaptiveTtl(manager, key))
                .orElse(properties.defaultExpiration());
        put(key, value, ttl, tables);
    }

    /**
     * 写入缓存并追踪表依赖
     */
    public void put(String key, Object value, Duration ttl, Collection<String> tables) {
        if (key == null || value == null) {
            return;
        }

        Duration effectiveTtl = ttl != null ? ttl : properties.defaultExpiration();
        Boolean written = guarded(OP_SET, () -> {
            cacheStore.set(key, value, effectiveTtl);
            return Boolean.TRUE;
        });
        if (!Boolean.TRUE.equals(written)) {
            log.debug("缓存写入已降级，跳过追踪: key={}", key);
            return;
        }
        recordAccess(key, CacheAccessType.SET);

        if (tables != null && !tables.isEmpty()) {
            invalidator.trackKey(tables, key);
        }
    }

    /**
     * 读取缓存，未命中时加载并写入
     */
    public <T> T getOrLoad(String key, Class<T> type, Collection<String> tables, Supplier<T> loader) {
        T cached = get(key, type);
        if (cached != null) {
            return cached;
        }

        T loaded = loader.get();
        if (loaded != null) {
            put(key, loaded, tables);
        }
        return loaded;
    }

    /**
     * 删除单个缓存键
     */
    public void evict(String key) {
        guarded(OP_REMOVE, () -> {
            cacheStore.remove(key);
            return null;
        });
        recordAccess(key, CacheAccessType.DELETE);
    }

    /**
     * 失效表缓存，按表级策略（ALL / PATTERN / RELATED）执行
     */
    public InvalidationResult invalidate(String tableName) {
        InvalidationRule policy = properties.findTablePolicy(tableName);
        if (policy == null) {
            return invalidator.invalidate(tableName);
        }
        return policy.apply(invalidator, properties.getMaxRelatedDepth());
    }

    public InvalidationResult invalidateBatch(Collection<String> tableNames) {
        return invalidator.invalidateBatch(tableNames);
    }

    public InvalidationResult invalidateByPattern(String pattern) {
        return invalidator.invalidateByPattern(pattern);
    }

    /**
     * 按策略选择淘汰键并从存储中删除
     *
     * @return 被删除的键，没有智能缓存管理器时为空
     */
    public List<String> evictByPolicy(CacheEvictionPolicy policy, int maxItems) {
        if (!intelligentManager.isPresent()) {
            return Collections.emptyList();
        }

        List<String> victims = intelligentManager.get().evictByPolicy(policy, maxItems);
        for (String key : victims) {
            guarded(OP_REMOVE, () -> {
                cacheStore.remove(key);
                return null;
            });
        }
        return victims;
    }

    public CacheInvalidator getInvalidator() {
        return invalidator;
    }

    public Optional<CacheCircuitBreaker> getCircuitBreaker() {
        return circuitBreaker;
    }

    public Optional<IntelligentCacheManager> getIntelligentManager() {
        return intelligentManager;
    }

    /**
     * 关闭全部组件
     */
    public void shutdown() {
        intelligentManager.ifPresent(IntelligentCacheManager::close);
        invalidator.close();
        circuitBreaker.ifPresent(CacheCircuitBreaker::close);
        log.info("TableArmor 已关闭");
    }

    /**
     * 经熔断器执行存储操作；静默降级时以 null 作为降级结果
     */
    private <T> T guarded(String operationName, Callable<T> operation) {
        boolean silent = properties.getErrorHandling().isSilentFallback();
        Callable<T> fallback = silent ? () -> null : null;

        if (circuitBreaker.isPresent()) {
            return circuitBreaker.get().execute(operationName, operation, fallback);
        }

        try {
            return operation.call();
        } catch (RuntimeException e) {
            if (!silent) {
                throw e;
            }
            log.warn("缓存操作失败，绕过缓存: operation={}", operationName, e);
            return null;
        } catch (Exception e) {
            if (!silent) {
                throw new TableArmorException("Cache operation failed: " + operationName, e,
                        TableArmorException.ErrorKind.BACKEND);
            }
            log.warn("缓存操作失败，绕过缓存: operation={}", operationName, e);
            return null;
        }
    }

    private void recordAccess(String key, CacheAccessType accessType) {
        if (!intelligentManager.isPresent()) {
            return;
        }
        try {
            intelligentManager.get().recordAccess(key, accessType);
        } catch (Exception e) {
            log.debug("记录缓存访问失败: key={}", key, e);
        }
    }

    private Duration safeAdaptiveTtl(IntelligentCacheManager manager, String key) {
        try {
            return manager.calculateAdaptiveTtl(key);
        } catch (Exception e) {
            log.debug("计算自适应 TTL 失败，使用默认值: key={}", key, e);
            return properties.defaultExpiration();
        }
    }
}
