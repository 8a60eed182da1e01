package cn.bafuka.tablearmor.consistency;

/**
 * 订阅句柄，由 {@link PubSubTransport#subscribe} 返回，用于取消订阅
 */
public interface Subscription {

    /**
     * 订阅的频道
     */
    String getChannel();
}
