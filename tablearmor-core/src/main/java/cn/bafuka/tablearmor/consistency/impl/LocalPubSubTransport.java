package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.consistency.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 进程内传输层
 * 单节点部署或测试使用；在发布线程上同步投递给所有订阅者
 */
@Slf4j
public class LocalPubSubTransport implements PubSubTransport {

    private final Map<String, List<LocalSubscription>> subscriptions = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, String payload) {
        List<LocalSubscription> subscribers = subscriptions.get(channel);
        if (subscribers == null) {
            return;
        }

        for (LocalSubscription subscriber : subscribers) {
            try {
                subscriber.handler.accept(payload);
            } catch (Exception e) {
                log.error("处理本地频道消息失败: channel={}", channel, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        LocalSubscription subscription = new LocalSubscription(channel, handler);
        subscriptions.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("已订阅本地频道: {}", channel);
        return subscription;
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        List<LocalSubscription> subscribers = subscriptions.get(subscription.getChannel());
        if (subscribers != null) {
            subscribers.remove(subscription);
        }
    }

    /**
     * 频道当前的订阅者数量
     */
    public int subscriberCount(String channel) {
        List<LocalSubscription> subscribers = subscriptions.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    private static final class LocalSubscription implements Subscription {

        private final String channel;

        private final Consumer<String> handler;

        private LocalSubscription(String channel, Consumer<String> handler) {
            this.channel = channel;
            this.handler = handler;
        }

        @Override
        public String getChannel() {
            return channel;
        }
    }
}
