package cn.bafuka.tablearmor.resilience;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 熔断器统计快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerStatistics {

    private CircuitBreakerState state;

    private int failureCount;

    /**
     * 最近一次失败时间，从未失败为 null
     */
    private Instant lastFailureTime;

    private Instant lastSuccessTime;

    @Builder.Default
    private List<OperationMetricsSnapshot> operationMetrics = new ArrayList<>();

    private long totalOperations;

    private long totalFailures;

    /**
     * 各操作平均耗时的平均值
     */
    @Builder.Default
    private Duration averageResponseTime = Duration.ZERO;
}
