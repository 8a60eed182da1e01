package cn.bafuka.tablearmor.core;

/**
 * 自定义错误处理钩子
 * 静默降级模式下，被吞掉的缓存后端错误会回调该接口
 */
@FunctionalInterface
public interface CacheErrorHandler {

    /**
     * 处理错误
     *
     * @param operation 发生错误的操作描述
     * @param error     错误
     */
    void handle(String operation, Throwable error);
}
