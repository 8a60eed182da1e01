package cn.bafuka.tablearmor.resilience;

/**
 * 熔断器状态变更监听器
 * 在状态锁之外回调，实现中抛出的异常只记录日志
 */
@FunctionalInterface
public interface CircuitBreakerStateListener {

    /**
     * 状态变更回调
     *
     * @param event 变更事件
     */
    void onStateChanged(CircuitBreakerStateChangedEvent event);
}
