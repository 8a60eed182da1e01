package cn.bafuka.tablearmor.resilience;

import cn.bafuka.tablearmor.exception.TableArmorException;

/**
 * 熔断器打开且没有提供降级操作
 */
public class CircuitBreakerOpenException extends TableArmorException {

    private final String operationName;

    public CircuitBreakerOpenException(String operationName) {
        super(String.format("Circuit breaker is open for operation '%s' and no fallback provided", operationName),
                ErrorKind.CIRCUIT_OPEN);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
