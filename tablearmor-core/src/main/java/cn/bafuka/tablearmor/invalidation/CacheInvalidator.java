package cn.bafuka.tablearmor.invalidation;

import cn.bafuka.tablearmor.model.InvalidationResult;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 缓存失效器接口
 * 按表维护依赖该表的缓存键集合（追踪集），表数据变更时批量删除这些键
 */
public interface CacheInvalidator extends AutoCloseable {

    /**
     * 将缓存键与表关联
     *
     * @param tableName 表名
     * @param cacheKey  缓存键
     */
    void trackKey(String tableName, String cacheKey);

    /**
     * 将缓存键与多张表关联
     *
     * @param tableNames 表名
     * @param cacheKey   缓存键
     */
    void trackKey(Collection<String> tableNames, String cacheKey);

    /**
     * 获取表关联的缓存键
     *
     * @param tableName 表名
     * @return 缓存键集合，出错时返回空集合
     */
    Set<String> getTrackedKeys(String tableName);

    /**
     * 失效表关联的全部缓存，并删除追踪集
     *
     * @param tableName 表名
     * @return 失效结果
     */
    InvalidationResult invalidate(String tableName);

    /**
     * 按通配模式失效
     *
     * @param pattern 通配模式（* 和 ?）
     * @return 失效结果
     */
    InvalidationResult invalidateByPattern(String pattern);

    /**
     * 连锁失效：深度优先遍历关联表，每张表只失效一次
     *
     * @param tableName     起始表
     * @param relatedTables 起始表的关联表
     * @param maxDepth      最大深度，小于 0 使用全局配置
     * @return 汇总的失效结果
     */
    InvalidationResult invalidateWithRelated(String tableName, Collection<String> relatedTables, int maxDepth);

    /**
     * 计算连锁失效会覆盖的表，按失效顺序返回，不执行失效
     *
     * @param tableName     起始表
     * @param relatedTables 起始表的关联表
     * @param maxDepth      最大深度，小于 0 使用全局配置
     * @return 表名列表，每张表只出现一次
     */
    List<String> resolveRelatedTables(String tableName, Collection<String> relatedTables, int maxDepth);

    /**
     * 批量失效多张表
     *
     * @param tableNames 表名
     * @return 汇总的失效结果
     */
    InvalidationResult invalidateBatch(Collection<String> tableNames);

    /**
     * 批量按模式失效
     *
     * @param patterns 通配模式
     * @return 汇总的失效结果
     */
    InvalidationResult invalidateByPatternBatch(Collection<String> patterns);

    /**
     * 释放资源
     */
    @Override
    default void close() {
    }
}
