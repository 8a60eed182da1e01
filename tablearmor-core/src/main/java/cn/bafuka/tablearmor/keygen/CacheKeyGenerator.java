package cn.bafuka.tablearmor.keygen;

import java.util.Map;

/**
 * 缓存键生成器接口
 * 相同的操作与参数（忽略插入顺序）总是生成相同的键，跨进程重启保持稳定
 */
public interface CacheKeyGenerator {

    /**
     * 生成缓存键
     * 格式: {namespace}_{version}_{operationId}_{action}_{parameterHash}，空段省略
     *
     * @param operationId 操作标识（如控制器名）
     * @param action      动作名
     * @param parameters  参数，可为 null
     * @return 缓存键
     */
    String generateKey(String operationId, String action, Map<String, ?> parameters);

    /**
     * 生成表追踪键
     * 格式: {namespace}_{version}_{trackingPrefix}_{tableName}
     *
     * @param tableName 表名
     * @return 追踪键
     */
    String generateTrackingKey(String tableName);

    /**
     * 生成参数哈希
     *
     * @param parameters 参数，可为 null
     * @return base36 哈希，无有效参数时返回空串
     */
    String generateParameterHash(Map<String, ?> parameters);
}
