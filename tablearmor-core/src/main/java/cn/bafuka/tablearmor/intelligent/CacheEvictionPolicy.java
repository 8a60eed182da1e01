package cn.bafuka.tablearmor.intelligent;

/**
 * 淘汰策略
 */
public enum CacheEvictionPolicy {

    /**
     * 最久未访问
     */
    LRU,

    /**
     * 访问次数最少
     */
    LFU,

    /**
     * 空闲超过默认过期时间
     */
    TTL,

    /**
     * 随机
     */
    RANDOM,

    /**
     * 最早首次访问
     */
    FIFO
}
