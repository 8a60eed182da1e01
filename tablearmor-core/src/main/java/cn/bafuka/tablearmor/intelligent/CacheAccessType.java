package cn.bafuka.tablearmor.intelligent;

/**
 * 缓存访问类型
 */
public enum CacheAccessType {

    /**
     * 命中
     */
    HIT,

    /**
     * 未命中
     */
    MISS,

    /**
     * 写入
     */
    SET,

    /**
     * 删除
     */
    DELETE,

    /**
     * 过期
     */
    EXPIRE
}
