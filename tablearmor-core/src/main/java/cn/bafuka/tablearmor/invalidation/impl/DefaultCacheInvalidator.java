package cn.bafuka.tablearmor.invalidation.impl;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.core.CacheErrorHandler;
import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.keygen.CacheKeyGenerator;
import cn.bafuka.tablearmor.model.InvalidationResult;
import cn.bafuka.tablearmor.model.InvalidationRule;
import cn.bafuka.tablearmor.model.InvalidationType;
import cn.bafuka.tablearmor.store.CacheStore;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;

/**
 * 缓存失效器默认实现
 * 追踪集以 Set 的形式存放在缓存存储中，TTL 为默认过期时间的 2 倍，保证追踪集比被追踪的数据活得更久
 */
@Slf4j
public class DefaultCacheInvalidator implements CacheInvalidator {

    /**
     * 批量删除的最大批大小
     */
    static final int MAX_BATCH_SIZE = 50;

    private final CacheStore cacheStore;

    private final CacheKeyGenerator keyGenerator;

    private final TableArmorProperties properties;

    /**
     * 自定义错误处理钩子，可为 null
     */
    private final CacheErrorHandler errorHandler;

    /**
     * 同一追踪集的读-改-写在进程内串行化
     */
    private final Striped<Lock> trackingLocks = Striped.lock(64);

    /**
     * 批量失效线程池
     */
    private final ExecutorService invalidationExecutor;

    private final int batchSize;

    public DefaultCacheInvalidator(CacheStore cacheStore,
                                   CacheKeyGenerator keyGenerator,
                                   TableArmorProperties properties,
                                   CacheErrorHandler errorHandler) {
        this.cacheStore = cacheStore;
        this.keyGenerator = keyGenerator;
        this.properties = properties;
        this.errorHandler = errorHandler;

        int processors = Runtime.getRuntime().availableProcessors();
        this.batchSize = Math.min(MAX_BATCH_SIZE, processors * 2);

        AtomicInteger threadIndex = new AtomicInteger();
        this.invalidationExecutor = Executors.newFixedThreadPool(Math.max(2, processors), r -> {
            Thread thread = new Thread(r, "tablearmor-invalidation-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void trackKey(String tableName, String cacheKey) {
        trackKey(Collections.singletonList(tableName), cacheKey);
    }

    @Override
    public void trackKey(Collection<String> tableNames, String cacheKey) {
        if (tableNames == null || tableNames.isEmpty() || cacheKey == null) {
            return;
        }

        try {
            Duration trackingTtl = properties.defaultExpiration().multipliedBy(2);
            for (String tableName : tableNames) {
                String trackingKey = keyGenerator.generateTrackingKey(tableName);
                Lock lock = trackingLocks.get(trackingKey);
                lock.lock();
                try {
                    // 存储可能按引用保存值，因此复制后再写回
                    Set<String> updated = new LinkedHashSet<>(readTrackedKeys(tableName));
                    updated.add(cacheKey);
                    cacheStore.set(trackingKey, updated, trackingTtl);
                } finally {
                    lock.unlock();
                }
            }

            if (properties.getLogging().isLogInvalidation()) {
                log.debug("追踪缓存键: key={}, tables={}", cacheKey, tableNames);
            }
        } catch (Exception e) {
            log.warn("追踪缓存键失败: key={}, tables={}", cacheKey, tableNames, e);
        }
    }

    @Override
    public Set<String> getTrackedKeys(String tableName) {
        try {
            return readTrackedKeys(tableName);
        } catch (Exception e) {
            log.warn("获取表追踪键失败: table={}", tableName, e);
            return Collections.emptySet();
        }
    }

    @Override
    public InvalidationResult invalidate(String tableName) {
        long startNanos = System.nanoTime();
        try {
            Set<String> keys = readTrackedKeys(tableName);
            if (keys.isEmpty()) {
                if (properties.getLogging().isLogInvalidation()) {
                    log.info("表没有关联的缓存键: table={}", tableName);
                }
                return InvalidationResult.empty();
            }

            int invalidated = 0;
            for (String key : keys) {
                if (removeQuietly(key)) {
                    invalidated++;
                }
            }

            cacheStore.remove(keyGenerator.generateTrackingKey(tableName));

            Duration elapsed = elapsedSince(startNanos);
            if (properties.getLogging().isLogInvalidation()) {
                log.info("表缓存失效完成: table={}, invalidated={}/{}, cost={}ms",
                        tableName, invalidated, keys.size(), elapsed.toMillis());
            }
            return InvalidationResult.builder()
                    .success(true)
                    .attemptedCount(keys.size())
                    .invalidatedCount(invalidated)
                    .duration(elapsed)
                    .build();
        } catch (RuntimeException e) {
            return handleFailure("invalidate " + tableName, e, startNanos);
        }
    }

    @Override
    public InvalidationResult invalidateByPattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return InvalidationResult.empty();
        }

        long startNanos = System.nanoTime();
        try {
            long removed = cacheStore.removeByPattern(pattern);
            Duration elapsed = elapsedSince(startNanos);
            if (properties.getLogging().isLogInvalidation()) {
                log.info("按模式失效完成: pattern={}, removed={}, cost={}ms", pattern, removed, elapsed.toMillis());
            }
            return InvalidationResult.builder()
                    .success(true)
                    .attemptedCount((int) removed)
                    .invalidatedCount((int) removed)
                    .duration(elapsed)
                    .build();
        } catch (RuntimeException e) {
            return handleFailure("invalidateByPattern " + pattern, e, startNanos);
        }
    }

    @Override
    public InvalidationResult invalidateWithRelated(String tableName, Collection<String> relatedTables, int maxDepth) {
        long startNanos = System.nanoTime();
        List<String> tables = resolveRelatedTables(tableName, relatedTables, maxDepth);

        List<InvalidationResult> results = new ArrayList<>(tables.size());
        for (String table : tables) {
            results.add(invalidate(table));
        }
        if (properties.getLogging().isLogInvalidation()) {
            log.info("连锁失效完成: root={}, tables={}", tableName, tables);
        }
        return merge(results, elapsedSince(startNanos));
    }

    @Override
    public List<String> resolveRelatedTables(String tableName, Collection<String> relatedTables, int maxDepth) {
        int effectiveDepth = maxDepth < 0 ? properties.getMaxRelatedDepth() : maxDepth;
        Set<String> visited = new LinkedHashSet<>();
        collectRelated(tableName, relatedTables, effectiveDepth, 0, visited);
        return new ArrayList<>(visited);
    }

    /**
     * 深度优先收集；起始表之外的关联关系来自表级 RELATED 策略
     */
    private void collectRelated(String tableName,
                                Collection<String> relatedTables,
                                int maxDepth,
                                int currentDepth,
                                Set<String> visited) {
        if (tableName == null || currentDepth >= maxDepth || !visited.add(tableName)) {
            return;
        }
        if (relatedTables == null) {
            return;
        }
        for (String related : relatedTables) {
            collectRelated(related, relationsOf(related), maxDepth, currentDepth + 1, visited);
        }
    }

    private Collection<String> relationsOf(String tableName) {
        InvalidationRule policy = properties.findTablePolicy(tableName);
        if (policy != null && policy.getInvalidationType() == InvalidationType.RELATED) {
            return policy.getRelatedTables();
        }
        return Collections.emptyList();
    }

    @Override
    public InvalidationResult invalidateBatch(Collection<String> tableNames) {
        if (tableNames == null || tableNames.isEmpty()) {
            return InvalidationResult.empty();
        }

        List<String> tables = new ArrayList<>(new LinkedHashSet<>(tableNames));
        long startNanos = System.nanoTime();
        try {
            // 并发读取全部追踪集并去重
            List<CompletableFuture<Set<String>>> reads = new ArrayList<>(tables.size());
            for (String table : tables) {
                reads.add(CompletableFuture.supplyAsync(() -> readTrackedKeys(table), invalidationExecutor));
            }
            Set<String> keys = new LinkedHashSet<>();
            for (CompletableFuture<Set<String>> read : reads) {
                keys.addAll(join(read));
            }

            if (keys.isEmpty()) {
                if (properties.getLogging().isLogInvalidation()) {
                    log.info("批量失效没有关联的缓存键: tables={}", tables);
                }
                return InvalidationResult.empty();
            }

            List<String> keyList = new ArrayList<>(keys);
            int invalidated = 0;
            for (int from = 0; from < keyList.size(); from += batchSize) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("批量失效被中断: tables={}, invalidated={}/{}", tables, invalidated, keyList.size());
                    return InvalidationResult.builder()
                            .success(false)
                            .attemptedCount(keyList.size())
                            .invalidatedCount(invalidated)
                            .duration(elapsedSince(startNanos))
                            .errorMessage("interrupted")
                            .build();
                }
                invalidated += removeBatch(keyList.subList(from, Math.min(from + batchSize, keyList.size())));
            }

            for (String table : tables) {
                cacheStore.remove(keyGenerator.generateTrackingKey(table));
            }

            Duration elapsed = elapsedSince(startNanos);
            if (properties.getLogging().isLogInvalidation()) {
                log.info("批量失效完成: tables={}, invalidated={}/{}, cost={}ms",
                        tables.size(), invalidated, keyList.size(), elapsed.toMillis());
            }
            return InvalidationResult.builder()
                    .success(true)
                    .attemptedCount(keyList.size())
                    .invalidatedCount(invalidated)
                    .duration(elapsed)
                    .build();
        } catch (RuntimeException e) {
            return handleFailure("invalidateBatch " + tables, e, startNanos);
        }
    }

    @Override
    public InvalidationResult invalidateByPatternBatch(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return InvalidationResult.empty();
        }

        long startNanos = System.nanoTime();
        List<CompletableFuture<InvalidationResult>> futures = new ArrayList<>();
        for (String pattern : new LinkedHashSet<>(patterns)) {
            futures.add(CompletableFuture.supplyAsync(() -> invalidateByPattern(pattern), invalidationExecutor));
        }

        List<InvalidationResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<InvalidationResult> future : futures) {
                results.add(join(future));
            }
        } catch (RuntimeException e) {
            return handleFailure("invalidateByPatternBatch " + patterns, e, startNanos);
        }
        return merge(results, elapsedSince(startNanos));
    }

    @Override
    public void close() {
        invalidationExecutor.shutdown();
        try {
            if (!invalidationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                invalidationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            invalidationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("缓存失效器已关闭");
    }

    /**
     * 读取追踪集，后端错误直接抛出
     */
    private Set<String> readTrackedKeys(String tableName) {
        Object value = cacheStore.get(keyGenerator.generateTrackingKey(tableName));
        if (value == null) {
            return Collections.emptySet();
        }

        // Redis 的 JSON 序列化可能把 Set 还原为 List
        Set<String> keys = new LinkedHashSet<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    keys.add(item.toString());
                }
            }
        } else if (value instanceof String[]) {
            Collections.addAll(keys, (String[]) value);
        } else {
            log.warn("追踪集类型不正确，忽略: table={}, type={}", tableName, value.getClass().getName());
        }
        return keys;
    }

    private int removeBatch(List<String> batch) {
        List<CompletableFuture<Boolean>> deletes = new ArrayList<>(batch.size());
        for (String key : batch) {
            deletes.add(CompletableFuture.supplyAsync(() -> removeQuietly(key), invalidationExecutor));
        }

        int removed = 0;
        for (CompletableFuture<Boolean> delete : deletes) {
            if (Boolean.TRUE.equals(join(delete))) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * 单个键删除失败只记录日志，不中断整批
     */
    private boolean removeQuietly(String key) {
        try {
            cacheStore.remove(key);
            return true;
        } catch (Exception e) {
            log.warn("删除缓存键失败: key={}", key, e);
            return false;
        }
    }

    private InvalidationResult handleFailure(String operation, RuntimeException error, long startNanos) {
        if (!properties.getErrorHandling().isSilentFallback()) {
            throw error;
        }

        log.error("缓存失效失败，静默降级: operation={}", operation, error);
        if (errorHandler != null) {
            try {
                errorHandler.handle(operation, error);
            } catch (Exception hookError) {
                log.warn("自定义错误处理器执行失败: operation={}", operation, hookError);
            }
        }
        return InvalidationResult.failed(error.getMessage(), elapsedSince(startNanos));
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static InvalidationResult merge(List<InvalidationResult> results, Duration elapsed) {
        boolean success = true;
        int attempted = 0;
        int invalidated = 0;
        String errorMessage = null;
        for (InvalidationResult result : results) {
            success &= result.isSuccess();
            attempted += result.getAttemptedCount();
            invalidated += result.getInvalidatedCount();
            if (errorMessage == null) {
                errorMessage = result.getErrorMessage();
            }
        }
        return InvalidationResult.builder()
                .success(success)
                .attemptedCount(attempted)
                .invalidatedCount(invalidated)
                .duration(elapsed)
                .errorMessage(errorMessage)
                .build();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
