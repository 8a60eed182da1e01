package cn.bafuka.tablearmor.resilience;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个操作的指标快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationMetricsSnapshot {

    private String operationName;

    private long totalOperations;

    private long successCount;

    private long failureCount;

    /**
     * 失败率（0-1）
     */
    private double failureRate;

    private Duration averageResponseTime;

    private Instant lastAccess;

    /**
     * 最近一次失败的异常信息
     */
    private String lastError;
}
