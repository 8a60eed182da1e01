package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.consistency.Subscription;
import cn.bafuka.tablearmor.exception.TableArmorException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.Codec;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RedissonPubSubTransport 单元测试
 */
public class RedissonPubSubTransportTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RTopic topic;

    private RedissonPubSubTransport transport;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        when(redissonClient.getTopic(anyString(), any(Codec.class))).thenReturn(topic);
        transport = new RedissonPubSubTransport(redissonClient);
    }

    /**
     * 测试发布消息
     */
    @Test
    public void testPublish() {
        when(topic.publish("payload")).thenReturn(2L);

        transport.publish("App:invalidation", "payload");

        verify(redissonClient).getTopic(eq("App:invalidation"), any(Codec.class));
        verify(topic).publish("payload");
    }

    /**
     * 测试发布失败包装为 BACKEND 错误
     */
    @Test
    public void testPublish_Failure() {
        when(topic.publish(any())).thenThrow(new IllegalStateException("connection refused"));

        try {
            transport.publish("App:invalidation", "payload");
            fail("Expected TableArmorException");
        } catch (TableArmorException e) {
            assertEquals(TableArmorException.ErrorKind.BACKEND, e.getKind());
        }
    }

    /**
     * 测试订阅、收消息和取消订阅
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testSubscribeAndUnsubscribe() {
        when(topic.addListener(eq(String.class), any(MessageListener.class))).thenReturn(7);
        List<String> received = new ArrayList<>();

        Subscription subscription = transport.subscribe("App:invalidation", received::add);

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(topic).addListener(eq(String.class), listener.capture());
        listener.getValue().onMessage("App:invalidation", "payload");
        assertEquals(1, received.size());
        assertEquals("payload", received.get(0));
        assertEquals("App:invalidation", subscription.getChannel());

        transport.unsubscribe(subscription);

        verify(topic).removeListener(7);
    }
}
