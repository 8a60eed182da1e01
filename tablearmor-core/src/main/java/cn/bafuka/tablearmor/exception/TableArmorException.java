package cn.bafuka.tablearmor.exception;

/**
 * TableArmor 异常基类
 * 通过 {@link ErrorKind} 区分错误类别，调用方可以按类别分支处理
 *
 * @author TableArmor Team
 * @since 1.0
 */
public class TableArmorException extends RuntimeException {

    /**
     * 错误类别
     */
    private final ErrorKind kind;

    public TableArmorException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public TableArmorException(String message, Throwable cause, ErrorKind kind) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 错误类别枚举
     */
    public enum ErrorKind {
        /**
         * 缓存存储或传输层错误（可恢复）
         */
        BACKEND("后端错误"),

        /**
         * 熔断器打开，未执行操作
         */
        CIRCUIT_OPEN("熔断器打开"),

        /**
         * 主操作与降级操作均失败
         */
        FALLBACK_FAILED("降级失败"),

        /**
         * 消息序列化或反序列化失败
         */
        SERIALIZATION("序列化错误"),

        /**
         * 配置错误
         */
        CONFIGURATION("配置错误");

        private final String description;

        ErrorKind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "kind=" + kind +
                ", message=" + getMessage() +
                '}';
    }
}
