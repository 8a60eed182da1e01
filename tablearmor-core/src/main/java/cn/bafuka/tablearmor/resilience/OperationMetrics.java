package cn.bafuka.tablearmor.resilience;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个操作的运行指标，仅用于观测，不参与熔断决策
 */
class OperationMetrics {

    private final String operationName;

    private final AtomicLong totalOperations = new AtomicLong();

    private final AtomicLong successCount = new AtomicLong();

    private final AtomicLong failureCount = new AtomicLong();

    private final AtomicLong totalLatencyNanos = new AtomicLong();

    private volatile long lastAccessMillis;

    private volatile String lastError;

    OperationMetrics(String operationName, long nowMillis) {
        this.operationName = operationName;
        this.lastAccessMillis = nowMillis;
    }

    void recordSuccess(long latencyNanos, long nowMillis) {
        totalOperations.incrementAndGet();
        successCount.incrementAndGet();
        totalLatencyNanos.addAndGet(latencyNanos);
        lastAccessMillis = nowMillis;
    }

    void recordFailure(Throwable error, long latencyNanos, long nowMillis) {
        totalOperations.incrementAndGet();
        failureCount.incrementAndGet();
        totalLatencyNanos.addAndGet(latencyNanos);
        lastAccessMillis = nowMillis;
        lastError = error == null ? null : error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    long getLastAccessMillis() {
        return lastAccessMillis;
    }

    OperationMetricsSnapshot snapshot() {
        long total = totalOperations.get();
        long failures = failureCount.get();
        return OperationMetricsSnapshot.builder()
                .operationName(operationName)
                .totalOperations(total)
                .successCount(successCount.get())
                .failureCount(failures)
                .failureRate(total == 0 ? 0.0 : (double) failures / total)
                .averageResponseTime(total == 0 ? Duration.ZERO : Duration.ofNanos(totalLatencyNanos.get() / total))
                .lastAccess(Instant.ofEpochMilli(lastAccessMillis))
                .lastError(lastError)
                .build();
    }
}
