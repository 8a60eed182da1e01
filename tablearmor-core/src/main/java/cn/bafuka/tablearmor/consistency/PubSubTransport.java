package cn.bafuka.tablearmor.consistency;

import java.util.function.Consumer;

/**
 * 发布/订阅传输层
 * 发布可以并发调用，由底层传输负责串行化
 *
 * 传输失败时抛出 {@link cn.bafuka.tablearmor.exception.TableArmorException}（BACKEND 类别）
 */
public interface PubSubTransport {

    /**
     * 发布消息
     *
     * @param channel 频道
     * @param payload 消息内容
     */
    void publish(String channel, String payload);

    /**
     * 订阅频道
     *
     * @param channel 频道
     * @param handler 消息处理器
     * @return 订阅句柄
     */
    Subscription subscribe(String channel, Consumer<String> handler);

    /**
     * 取消订阅，重复取消为空操作
     *
     * @param subscription 订阅句柄
     */
    void unsubscribe(Subscription subscription);
}
