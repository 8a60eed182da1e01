package cn.bafuka.tablearmor.model;

/**
 * 缓存失效类型
 */
public enum InvalidationType {

    /**
     * 删除表关联的全部缓存
     */
    ALL,

    /**
     * 只删除匹配模式的缓存
     */
    PATTERN,

    /**
     * 连同关联表的缓存一起删除
     */
    RELATED
}
