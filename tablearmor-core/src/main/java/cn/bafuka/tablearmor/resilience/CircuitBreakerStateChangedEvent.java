package cn.bafuka.tablearmor.resilience;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 熔断器状态变更事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerStateChangedEvent {

    private CircuitBreakerState oldState;

    private CircuitBreakerState newState;

    /**
     * 变更时的失败计数
     */
    private int failureCount;

    private Instant timestamp;
}
