package cn.bafuka.tablearmor.store;

import java.time.Duration;

/**
 * 缓存存储接口
 * 引擎只消费这五个操作，值的序列化格式由具体实现负责
 *
 * 实现类在后端不可用时抛出
 * {@link cn.bafuka.tablearmor.exception.TableArmorException}（BACKEND 类别）
 */
public interface CacheStore {

    /**
     * 获取缓存值
     *
     * @param key 缓存键
     * @return 缓存值，不存在返回 null
     */
    Object get(String key);

    /**
     * 写入缓存
     *
     * @param key   缓存键
     * @param value 缓存值
     * @param ttl   过期时间，null 表示使用实现的默认值
     */
    void set(String key, Object value, Duration ttl);

    /**
     * 删除缓存，键不存在时为空操作
     *
     * @param key 缓存键
     */
    void remove(String key);

    /**
     * 删除匹配通配模式的全部缓存
     *
     * @param pattern 通配模式（支持 * 和 ?）
     * @return 删除的键数量
     */
    long removeByPattern(String pattern);

    /**
     * 判断键是否存在
     *
     * @param key 缓存键
     * @return true 存在
     */
    boolean exists(String key);
}
