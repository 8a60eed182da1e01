package cn.bafuka.tablearmor.resilience;

import cn.bafuka.tablearmor.exception.TableArmorException;

/**
 * 主操作与降级操作均失败
 * cause 为降级操作的异常，{@link #getPrimaryCause()} 为主操作的异常（熔断打开时为 null）
 */
public class CircuitBreakerFallbackException extends TableArmorException {

    private final String operationName;

    private final Throwable primaryCause;

    public CircuitBreakerFallbackException(String operationName, Throwable fallbackCause, Throwable primaryCause) {
        super(String.format("Both primary operation and fallback failed for '%s'", operationName),
                fallbackCause, ErrorKind.FALLBACK_FAILED);
        this.operationName = operationName;
        this.primaryCause = primaryCause;
        if (primaryCause != null && primaryCause != fallbackCause) {
            addSuppressed(primaryCause);
        }
    }

    public String getOperationName() {
        return operationName;
    }

    public Throwable getPrimaryCause() {
        return primaryCause;
    }

    public Throwable getFallbackCause() {
        return getCause();
    }
}
