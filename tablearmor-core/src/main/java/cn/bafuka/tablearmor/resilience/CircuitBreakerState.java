package cn.bafuka.tablearmor.resilience;

/**
 * 熔断器状态
 */
public enum CircuitBreakerState {

    /**
     * 关闭：正常放行
     */
    CLOSED,

    /**
     * 打开：拒绝执行，走降级
     */
    OPEN,

    /**
     * 半开：放行探测请求
     */
    HALF_OPEN
}
