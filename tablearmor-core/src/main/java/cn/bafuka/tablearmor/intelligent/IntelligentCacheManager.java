package cn.bafuka.tablearmor.intelligent;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * 智能缓存管理器
 * 观察缓存访问，提供热点键识别、自适应 TTL 和淘汰候选选择
 *
 * 本组件只负责选择，实际的缓存读写和删除由调用方完成
 */
public interface IntelligentCacheManager extends AutoCloseable {

    /**
     * 记录一次访问
     *
     * @param cacheKey   缓存键
     * @param accessType 访问类型
     */
    void recordAccess(String cacheKey, CacheAccessType accessType);

    /**
     * 获取热点键，按访问速率降序
     *
     * @param topN 数量，不超过候选上限
     * @return 热点键
     */
    List<HotKeyInfo> getHotKeys(int topN);

    /**
     * 计算自适应 TTL
     *
     * @param cacheKey 缓存键
     * @return TTL，没有指标时返回默认过期时间
     */
    Duration calculateAdaptiveTtl(String cacheKey);

    /**
     * 计算键的优先级
     *
     * @param cacheKey 缓存键
     * @return 优先级，没有指标时为 0
     */
    double calculateKeyPriority(String cacheKey);

    /**
     * 按策略选择淘汰的键，并删除这些键的指标
     *
     * @param policy   淘汰策略
     * @param maxItems 最多选择数量
     * @return 被选中的键
     */
    List<String> evictByPolicy(CacheEvictionPolicy policy, int maxItems);

    /**
     * 预热：为每个键记录一次写入以初始化指标
     *
     * @param keys 缓存键
     */
    void warmCache(Collection<String> keys);

    /**
     * 启动周期性热点扫描
     */
    void startHotKeyDetection();

    /**
     * 停止周期性热点扫描
     */
    void stopHotKeyDetection();

    /**
     * 是否正在扫描
     */
    boolean isHotKeyDetectionActive();

    @Override
    void close();
}
