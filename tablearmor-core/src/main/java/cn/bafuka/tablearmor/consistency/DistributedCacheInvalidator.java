package cn.bafuka.tablearmor.consistency;

import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.model.InvalidationResult;

import java.util.Collection;

/**
 * 分布式缓存失效器
 * 所有失效方法先在本地执行，再广播给其他节点；收到的远端消息只在本地应用，不再转发
 */
public interface DistributedCacheInvalidator extends CacheInvalidator {

    /**
     * 本实例 ID（主机_进程号_随机后缀），构造后不变
     */
    String getInstanceId();

    /**
     * 订阅失效频道，重复调用为空操作
     */
    void startListening();

    /**
     * 取消订阅，重复调用为空操作
     */
    void stopListening();

    boolean isListening();

    /**
     * 本地失效单表并广播
     */
    InvalidationResult broadcastInvalidation(String tableName);

    /**
     * 本地按模式失效并广播
     */
    InvalidationResult broadcastInvalidationByPattern(String pattern);

    /**
     * 本地批量失效并广播
     */
    InvalidationResult broadcastBatchInvalidation(Collection<String> tableNames);

    void addInvalidationListener(InvalidationListener listener);

    void removeInvalidationListener(InvalidationListener listener);
}
