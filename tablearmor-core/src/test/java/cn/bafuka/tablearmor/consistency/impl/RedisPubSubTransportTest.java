package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.consistency.Subscription;
import cn.bafuka.tablearmor.exception.TableArmorException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * RedisPubSubTransport 单元测试
 */
public class RedisPubSubTransportTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private RedisMessageListenerContainer listenerContainer;

    private RedisPubSubTransport transport;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        transport = new RedisPubSubTransport(redisTemplate, listenerContainer);
    }

    /**
     * 测试发布消息
     */
    @Test
    public void testPublish() {
        transport.publish("App:invalidation", "payload");

        verify(redisTemplate).convertAndSend("App:invalidation", "payload");
    }

    /**
     * 测试发布失败包装为 BACKEND 错误
     */
    @Test
    public void testPublish_Failure() {
        doThrow(new IllegalStateException("connection refused"))
                .when(redisTemplate).convertAndSend(anyString(), any());

        try {
            transport.publish("App:invalidation", "payload");
            fail("Expected TableArmorException");
        } catch (TableArmorException e) {
            assertEquals(TableArmorException.ErrorKind.BACKEND, e.getKind());
        }
    }

    /**
     * 测试订阅后收到的消息按 UTF-8 解码
     */
    @Test
    public void testSubscribe_DeliversUtf8Payload() {
        List<String> received = new ArrayList<>();
        Subscription subscription = transport.subscribe("App:invalidation", received::add);

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        ArgumentCaptor<ChannelTopic> topic = ArgumentCaptor.forClass(ChannelTopic.class);
        verify(listenerContainer).addMessageListener(listener.capture(), topic.capture());
        assertEquals("App:invalidation", topic.getValue().getTopic());
        assertEquals("App:invalidation", subscription.getChannel());

        Message message = mock(Message.class);
        when(message.getBody()).thenReturn("{\"表\":\"用户\"}".getBytes(StandardCharsets.UTF_8));
        listener.getValue().onMessage(message, null);

        assertEquals(1, received.size());
        assertEquals("{\"表\":\"用户\"}", received.get(0));
    }

    /**
     * 测试处理器异常不会抛到监听容器
     */
    @Test
    public void testSubscribe_HandlerFailureContained() {
        transport.subscribe("App:invalidation", payload -> {
            throw new IllegalStateException("handler broken");
        });

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(listenerContainer).addMessageListener(listener.capture(), any(ChannelTopic.class));

        Message message = mock(Message.class);
        when(message.getBody()).thenReturn("x".getBytes(StandardCharsets.UTF_8));
        listener.getValue().onMessage(message, null);
    }

    /**
     * 测试取消订阅移除同一个监听器
     */
    @Test
    public void testUnsubscribe() {
        Subscription subscription = transport.subscribe("App:invalidation", payload -> { });

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(listenerContainer).addMessageListener(listener.capture(), any(ChannelTopic.class));

        transport.unsubscribe(subscription);

        verify(listenerContainer).removeMessageListener(eq(listener.getValue()), any(ChannelTopic.class));
    }

    /**
     * 测试非本传输层的订阅句柄被忽略
     */
    @Test
    public void testUnsubscribe_ForeignHandle() {
        transport.unsubscribe(() -> "App:invalidation");

        verifyNoInteractions(listenerContainer);
    }
}
