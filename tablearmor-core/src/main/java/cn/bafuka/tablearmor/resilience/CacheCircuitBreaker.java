package cn.bafuka.tablearmor.resilience;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.exception.TableArmorException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 缓存熔断器
 * 缓存后端连续失败达到阈值后打开，打开期间直接走降级，超时后半开探测
 *
 * 熔断状态是实例级的；按操作名统计的指标只用于观测
 */
@Slf4j
public class CacheCircuitBreaker implements AutoCloseable {

    private final TableArmorProperties.CircuitBreaker config;

    private final Clock clock;

    /**
     * 状态与失败计数的临界区
     */
    private final Object stateLock = new Object();

    private volatile CircuitBreakerState state = CircuitBreakerState.CLOSED;

    private volatile int failureCount = 0;

    /**
     * 最近一次失败时间（毫秒），0 表示从未失败
     */
    private final AtomicLong lastFailureMillis = new AtomicLong();

    private final AtomicLong lastSuccessMillis = new AtomicLong();

    private final Map<String, OperationMetrics> operationMetrics = new ConcurrentHashMap<>();

    private final List<CircuitBreakerStateListener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService healthCheckScheduler;

    public CacheCircuitBreaker(TableArmorProperties.CircuitBreaker config) {
        this(config, Clock.systemUTC());
    }

    public CacheCircuitBreaker(TableArmorProperties.CircuitBreaker config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("Circuit breaker config cannot be null");
        }
        config.validate();
        this.config = config;
        this.clock = clock;
        this.lastSuccessMillis.set(clock.millis());

        this.healthCheckScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "tablearmor-breaker-health");
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.getHealthCheckInterval().toMillis();
        healthCheckScheduler.scheduleAtFixedRate(this::performHealthCheck, interval, interval, TimeUnit.MILLISECONDS);

        log.info("缓存熔断器初始化: threshold={}, timeout={}", config.getFailureThreshold(), config.getTimeout());
    }

    /**
     * 同步执行受保护的操作
     *
     * @param operationName 操作名
     * @param operation     主操作
     * @param fallback      降级操作，可为 null
     * @return 主操作或降级操作的结果
     * @throws CircuitBreakerOpenException     熔断打开且没有降级
     * @throws CircuitBreakerFallbackException 降级操作失败
     */
    public <T> T execute(String operationName, Callable<T> operation, Callable<T> fallback) {
        if (!canExecute()) {
            log.warn("熔断器打开，拒绝执行: operation={}", operationName);
            return executeFallback(operationName, fallback, null);
        }

        OperationMetrics metrics = metricsFor(operationName);
        long startNanos = System.nanoTime();
        try {
            T result = operation.call();
            long latency = System.nanoTime() - startNanos;
            recordSuccess(operationName, latency);
            metrics.recordSuccess(latency, clock.millis());
            return result;
        } catch (Exception e) {
            long latency = System.nanoTime() - startNanos;
            recordFailure(operationName, e, latency);
            metrics.recordFailure(e, latency, clock.millis());

            if (fallback != null) {
                log.warn("缓存操作失败，执行降级: operation={}", operationName);
                return executeFallback(operationName, fallback, e);
            }
            throw propagate(operationName, e);
        }
    }

    /**
     * 同步执行，没有降级操作
     */
    public <T> T execute(String operationName, Callable<T> operation) {
        return execute(operationName, operation, null);
    }

    /**
     * 异步执行受保护的操作
     *
     * @param operationName 操作名
     * @param operation     主操作
     * @param fallback      降级操作，可为 null
     * @return 结果 future，失败时以 {@link CircuitBreakerOpenException} /
     * {@link CircuitBreakerFallbackException} 或主操作的异常完成
     */
    public <T> CompletableFuture<T> executeAsync(String operationName,
                                                 Supplier<CompletableFuture<T>> operation,
                                                 Supplier<CompletableFuture<T>> fallback) {
        if (!canExecute()) {
            log.warn("熔断器打开，拒绝执行: operation={}", operationName);
            return executeFallbackAsync(operationName, fallback, null);
        }

        OperationMetrics metrics = metricsFor(operationName);
        long startNanos = System.nanoTime();
        CompletableFuture<T> primary;
        try {
            primary = operation.get();
        } catch (Exception e) {
            primary = failedFuture(e);
        }

        return primary.handle((result, error) -> {
            long latency = System.nanoTime() - startNanos;
            if (error == null) {
                recordSuccess(operationName, latency);
                metrics.recordSuccess(latency, clock.millis());
                return CompletableFuture.completedFuture(result);
            }

            Throwable cause = unwrap(error);
            recordFailure(operationName, cause, latency);
            metrics.recordFailure(cause, latency, clock.millis());
            if (fallback != null) {
                log.warn("缓存操作失败，执行降级: operation={}", operationName);
                return executeFallbackAsync(operationName, fallback, cause);
            }
            return CacheCircuitBreaker.<T>failedFuture(cause);
        }).thenCompose(future -> future);
    }

    /**
     * 判断当前是否可以执行，OPEN 且超时已过时转为 HALF_OPEN
     */
    private boolean canExecute() {
        CircuitBreakerState current = state;
        if (current != CircuitBreakerState.OPEN) {
            return true;
        }

        CircuitBreakerStateChangedEvent event = null;
        synchronized (stateLock) {
            if (state == CircuitBreakerState.OPEN) {
                if (clock.millis() - lastFailureMillis.get() < config.getTimeout().toMillis()) {
                    return false;
                }
                event = changeState(CircuitBreakerState.HALF_OPEN);
            }
        }
        notifyListeners(event);
        return true;
    }

    private void recordSuccess(String operationName, long latencyNanos) {
        lastSuccessMillis.set(clock.millis());

        CircuitBreakerStateChangedEvent event = null;
        synchronized (stateLock) {
            if (state == CircuitBreakerState.HALF_OPEN) {
                failureCount = 0;
                event = changeState(CircuitBreakerState.CLOSED);
            } else if (state == CircuitBreakerState.CLOSED && failureCount > 0) {
                // 成功一次抵消一次失败
                failureCount = failureCount - 1;
            }
        }
        notifyListeners(event);

        log.debug("缓存操作成功: operation={}, cost={}ms", operationName, TimeUnit.NANOSECONDS.toMillis(latencyNanos));
    }

    private void recordFailure(String operationName, Throwable error, long latencyNanos) {
        lastFailureMillis.set(clock.millis());

        CircuitBreakerStateChangedEvent event = null;
        int failures;
        synchronized (stateLock) {
            failureCount = failureCount + 1;
            failures = failureCount;
            if (state == CircuitBreakerState.HALF_OPEN) {
                event = changeState(CircuitBreakerState.OPEN);
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.getFailureThreshold()) {
                event = changeState(CircuitBreakerState.OPEN);
            }
        }
        notifyListeners(event);

        log.warn("缓存操作失败: operation={}, cost={}ms, failures={}, error={}",
                operationName, TimeUnit.NANOSECONDS.toMillis(latencyNanos), failures, String.valueOf(error));
    }

    /**
     * 必须持有 stateLock 调用
     */
    private CircuitBreakerStateChangedEvent changeState(CircuitBreakerState newState) {
        CircuitBreakerState oldState = state;
        state = newState;
        log.info("熔断器状态变更: {} -> {}, failures={}", oldState, newState, failureCount);
        return CircuitBreakerStateChangedEvent.builder()
                .oldState(oldState)
                .newState(newState)
                .failureCount(failureCount)
                .timestamp(clock.instant())
                .build();
    }

    private void notifyListeners(CircuitBreakerStateChangedEvent event) {
        if (event == null) {
            return;
        }
        for (CircuitBreakerStateListener listener : listeners) {
            try {
                listener.onStateChanged(event);
            } catch (Exception e) {
                log.error("熔断器状态监听器执行失败: listener={}", listener, e);
            }
        }
    }

    private <T> T executeFallback(String operationName, Callable<T> fallback, Throwable primaryError) {
        if (fallback == null) {
            throw new CircuitBreakerOpenException(operationName);
        }

        try {
            T result = fallback.call();
            log.debug("降级执行成功: operation={}", operationName);
            return result;
        } catch (Exception e) {
            log.error("降级执行失败: operation={}", operationName, e);
            throw new CircuitBreakerFallbackException(operationName, e, primaryError);
        }
    }

    private <T> CompletableFuture<T> executeFallbackAsync(String operationName,
                                                        Supplier<CompletableFuture<T>> fallback,
                                                        Throwable primaryError) {
        if (fallback == null) {
            return failedFuture(new CircuitBreakerOpenException(operationName));
        }

        CompletableFuture<T> future;
        try {
            future = fallback.get();
        } catch (Exception e) {
            future = failedFuture(e);
        }

        return future.handle((result, error) -> {
            if (error == null) {
                log.debug("降级执行成功: operation={}", operationName);
                return CompletableFuture.completedFuture(result);
            }
            Throwable cause = unwrap(error);
            log.error("降级执行失败: operation={}", operationName, cause);
            return CacheCircuitBreaker.<T>failedFuture(
                    new CircuitBreakerFallbackException(operationName, cause, primaryError));
        }).thenCompose(f -> f);
    }

    /**
     * 健康检查：清理过期的操作指标，OPEN 超过 2 倍超时时间时强制半开
     */
    void performHealthCheck() {
        try {
            long now = clock.millis();
            long cutoff = now - config.getMetricRetention().toMillis();
            Iterator<Map.Entry<String, OperationMetrics>> iterator = operationMetrics.entrySet().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getValue().getLastAccessMillis() < cutoff) {
                    iterator.remove();
                }
            }

            CircuitBreakerStateChangedEvent event = null;
            synchronized (stateLock) {
                if (state == CircuitBreakerState.OPEN
                        && now - lastFailureMillis.get() >= config.getTimeout().toMillis() * 2) {
                    log.info("熔断器自动恢复，转为半开");
                    event = changeState(CircuitBreakerState.HALF_OPEN);
                }
            }
            notifyListeners(event);

            log.debug("熔断器健康检查完成: state={}, failures={}", state, failureCount);
        } catch (Exception e) {
            log.error("熔断器健康检查失败", e);
        }
    }

    private OperationMetrics metricsFor(String operationName) {
        return operationMetrics.computeIfAbsent(operationName, name -> new OperationMetrics(name, clock.millis()));
    }

    /**
     * 获取统计快照
     */
    public CircuitBreakerStatistics getStatistics() {
        List<OperationMetricsSnapshot> snapshots = new ArrayList<>();
        for (OperationMetrics metrics : operationMetrics.values()) {
            snapshots.add(metrics.snapshot());
        }

        long totalOperations = 0;
        long totalFailures = 0;
        long averageNanosSum = 0;
        for (OperationMetricsSnapshot snapshot : snapshots) {
            totalOperations += snapshot.getTotalOperations();
            totalFailures += snapshot.getFailureCount();
            averageNanosSum += snapshot.getAverageResponseTime().toNanos();
        }

        long lastFailure = lastFailureMillis.get();
        return CircuitBreakerStatistics.builder()
                .state(state)
                .failureCount(failureCount)
                .lastFailureTime(lastFailure == 0 ? null : Instant.ofEpochMilli(lastFailure))
                .lastSuccessTime(Instant.ofEpochMilli(lastSuccessMillis.get()))
                .operationMetrics(snapshots)
                .totalOperations(totalOperations)
                .totalFailures(totalFailures)
                .averageResponseTime(snapshots.isEmpty()
                        ? Duration.ZERO : Duration.ofNanos(averageNanosSum / snapshots.size()))
                .build();
    }

    public void addStateListener(CircuitBreakerStateListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeStateListener(CircuitBreakerStateListener listener) {
        listeners.remove(listener);
    }

    public CircuitBreakerState getState() {
        return state;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public boolean isOpen() {
        return state == CircuitBreakerState.OPEN;
    }

    public boolean isHalfOpen() {
        return state == CircuitBreakerState.HALF_OPEN;
    }

    public boolean isClosed() {
        return state == CircuitBreakerState.CLOSED;
    }

    @Override
    public void close() {
        healthCheckScheduler.shutdown();
        try {
            if (!healthCheckScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                healthCheckScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            healthCheckScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        operationMetrics.clear();
        log.info("缓存熔断器已关闭");
    }

    private static RuntimeException propagate(String operationName, Exception error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        return new TableArmorException("Cache operation failed: " + operationName, error,
                TableArmorException.ErrorKind.BACKEND);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <T> CompletableFuture<T> failedFuture(Throwable error) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }
}
