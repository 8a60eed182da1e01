package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.consistency.Subscription;
import cn.bafuka.tablearmor.exception.TableArmorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * 基于 Spring Data Redis Pub/Sub 的传输层
 * 消息体按 UTF-8 字符串收发，不经过 RedisTemplate 的值序列化器
 */
@Slf4j
public class RedisPubSubTransport implements PubSubTransport {

    private final StringRedisTemplate redisTemplate;

    /**
     * Redis 消息监听容器
     */
    private final RedisMessageListenerContainer listenerContainer;

    public RedisPubSubTransport(StringRedisTemplate redisTemplate,
                                RedisMessageListenerContainer listenerContainer) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
    }

    @Override
    public void publish(String channel, String payload) {
        try {
            redisTemplate.convertAndSend(channel, payload);
        } catch (Exception e) {
            throw new TableArmorException("Redis 发布消息失败: channel=" + channel, e,
                    TableArmorException.ErrorKind.BACKEND);
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        MessageListener listener = (message, pattern) -> {
            try {
                handler.accept(new String(message.getBody(), StandardCharsets.UTF_8));
            } catch (Exception e) {
                log.error("处理 Redis 频道消息失败: channel={}", channel, e);
            }
        };

        ChannelTopic topic = new ChannelTopic(channel);
        try {
            listenerContainer.addMessageListener(listener, topic);
        } catch (Exception e) {
            throw new TableArmorException("Redis 订阅失败: channel=" + channel, e,
                    TableArmorException.ErrorKind.BACKEND);
        }

        log.info("已订阅 Redis 频道: {}", channel);
        return new RedisSubscription(topic, listener);
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (!(subscription instanceof RedisSubscription)) {
            log.warn("非 Redis 订阅句柄，忽略: {}", subscription);
            return;
        }

        RedisSubscription redisSubscription = (RedisSubscription) subscription;
        listenerContainer.removeMessageListener(redisSubscription.listener, redisSubscription.topic);
        log.info("已取消订阅 Redis 频道: {}", redisSubscription.getChannel());
    }

    private static final class RedisSubscription implements Subscription {

        private final ChannelTopic topic;

        private final MessageListener listener;

        private RedisSubscription(ChannelTopic topic, MessageListener listener) {
            this.topic = topic;
            this.listener = listener;
        }

        @Override
        public String getChannel() {
            return topic.getTopic();
        }
    }
}
