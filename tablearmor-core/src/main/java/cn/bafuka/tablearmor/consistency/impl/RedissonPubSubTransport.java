package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.consistency.Subscription;
import cn.bafuka.tablearmor.exception.TableArmorException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

import java.util.function.Consumer;

/**
 * 基于 Redisson RTopic 的传输层
 */
@Slf4j
public class RedissonPubSubTransport implements PubSubTransport {

    private final RedissonClient redissonClient;

    public RedissonPubSubTransport(RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    @Override
    public void publish(String channel, String payload) {
        try {
            long receivers = topic(channel).publish(payload);
            log.debug("Redisson 发布消息: channel={}, receivers={}", channel, receivers);
        } catch (Exception e) {
            throw new TableArmorException("Redisson 发布消息失败: channel=" + channel, e,
                    TableArmorException.ErrorKind.BACKEND);
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        try {
            int listenerId = topic(channel).addListener(String.class, (ch, message) -> {
                try {
                    handler.accept(message);
                } catch (Exception e) {
                    log.error("处理 Redisson 频道消息失败: channel={}", channel, e);
                }
            });
            log.info("已订阅 Redisson 频道: {}", channel);
            return new RedissonSubscription(channel, listenerId);
        } catch (Exception e) {
            throw new TableArmorException("Redisson 订阅失败: channel=" + channel, e,
                    TableArmorException.ErrorKind.BACKEND);
        }
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (!(subscription instanceof RedissonSubscription)) {
            log.warn("非 Redisson 订阅句柄，忽略: {}", subscription);
            return;
        }

        RedissonSubscription redissonSubscription = (RedissonSubscription) subscription;
        topic(redissonSubscription.getChannel()).removeListener(redissonSubscription.listenerId);
        log.info("已取消订阅 Redisson 频道: {}", redissonSubscription.getChannel());
    }

    private RTopic topic(String channel) {
        return redissonClient.getTopic(channel, StringCodec.INSTANCE);
    }

    private static final class RedissonSubscription implements Subscription {

        private final String channel;

        private final int listenerId;

        private RedissonSubscription(String channel, int listenerId) {
            this.channel = channel;
            this.listenerId = listenerId;
        }

        @Override
        public String getChannel() {
            return channel;
        }
    }
}
