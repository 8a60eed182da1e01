package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.consistency.InvalidationEnvelope;
import cn.bafuka.tablearmor.consistency.InvalidationEnvelopeCodec;
import cn.bafuka.tablearmor.consistency.InvalidationEvent;
import cn.bafuka.tablearmor.consistency.InvalidationMessage;
import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.exception.TableArmorException;
import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.invalidation.impl.DefaultCacheInvalidator;
import cn.bafuka.tablearmor.keygen.impl.DefaultCacheKeyGenerator;
import cn.bafuka.tablearmor.model.InvalidationResult;
import cn.bafuka.tablearmor.model.InvalidationRule;
import cn.bafuka.tablearmor.model.InvalidationType;
import cn.bafuka.tablearmor.store.impl.CaffeineCacheStore;
import cn.bafuka.tablearmor.support.MutableClock;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * BroadcastingCacheInvalidator 单元测试
 * 两个实例通过进程内传输层互相广播
 */
public class BroadcastingCacheInvalidatorTest {

    private MutableClock clock;

    private TableArmorProperties properties;

    private LocalPubSubTransport transport;

    private CaffeineCacheStore storeA;

    private CaffeineCacheStore storeB;

    private BroadcastingCacheInvalidator nodeA;

    private BroadcastingCacheInvalidator nodeB;

    private final List<InvalidationEvent> eventsB = new ArrayList<>();

    @Before
    public void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        properties = new TableArmorProperties();
        properties.setNamespace("App");
        transport = new LocalPubSubTransport();

        storeA = new CaffeineCacheStore(Duration.ofMinutes(30));
        storeB = new CaffeineCacheStore(Duration.ofMinutes(30));
        nodeA = node(storeA);
        nodeB = node(storeB);
        nodeA.startListening();
        nodeB.startListening();
        nodeB.addInvalidationListener(eventsB::add);
    }

    @After
    public void tearDown() {
        nodeA.close();
        nodeB.close();
    }

    private BroadcastingCacheInvalidator node(CaffeineCacheStore store) {
        DefaultCacheInvalidator local = new DefaultCacheInvalidator(store,
                new DefaultCacheKeyGenerator(properties), properties, null);
        return new BroadcastingCacheInvalidator(local, transport, properties, clock);
    }

    private String envelopeFrom(String source, InvalidationMessage message) {
        return InvalidationEnvelopeCodec.encode(InvalidationEnvelope.builder()
                .sourceInstanceId(source)
                .message(message)
                .timestamp(clock.instant())
                .build());
    }

    /**
     * 测试频道名与实例 ID 格式
     */
    @Test
    public void testChannelAndInstanceId() {
        assertEquals("App:invalidation", nodeA.getChannel());
        assertNotEquals(nodeA.getInstanceId(), nodeB.getInstanceId());
        assertTrue(nodeA.getInstanceId().matches(".+_.+_[0-9a-f]{8}"));
    }

    /**
     * 测试表失效广播到其他实例
     */
    @Test
    public void testInvalidate_PropagatesToPeer() {
        storeA.set("a1", "x", null);
        storeB.set("b1", "x", null);
        nodeA.trackKey("Users", "a1");
        nodeB.trackKey("Users", "b1");

        InvalidationResult result = nodeA.invalidate("Users");

        assertTrue(result.isSuccess());
        assertNull(storeA.get("a1"));
        assertNull(storeB.get("b1"));
        assertTrue(nodeB.getTrackedKeys("Users").isEmpty());

        assertEquals(1, eventsB.size());
        InvalidationEvent event = eventsB.get(0);
        assertEquals(nodeA.getInstanceId(), event.getSourceInstanceId());
        assertEquals(InvalidationMessage.MessageType.TABLE, event.getMessage().getType());
        assertEquals(clock.instant(), event.getAppliedAt());
    }

    /**
     * 测试本实例发出的消息不会再次应用
     */
    @Test
    public void testSelfEchoSuppressed() {
        List<InvalidationEvent> eventsA = new ArrayList<>();
        nodeA.addInvalidationListener(eventsA::add);

        nodeA.invalidate("Users");

        assertTrue(eventsA.isEmpty());
        assertEquals(1, eventsB.size());
    }

    /**
     * 测试按模式失效广播
     */
    @Test
    public void testInvalidateByPattern_PropagatesToPeer() {
        storeB.set("App_Users_1", "x", null);
        storeB.set("App_Orders_1", "y", null);

        nodeA.invalidateByPattern("App_Users_*");

        assertNull(storeB.get("App_Users_1"));
        assertEquals("y", storeB.get("App_Orders_1"));
        assertEquals(InvalidationMessage.MessageType.PATTERN, eventsB.get(0).getMessage().getType());
    }

    /**
     * 测试批量失效广播
     */
    @Test
    public void testInvalidateBatch_PropagatesToPeer() {
        storeB.set("u", "x", null);
        storeB.set("o", "y", null);
        nodeB.trackKey("Users", "u");
        nodeB.trackKey("Orders", "o");

        nodeA.invalidateBatch(Arrays.asList("Users", "Orders"));

        assertNull(storeB.get("u"));
        assertNull(storeB.get("o"));
        assertEquals(InvalidationMessage.MessageType.BATCH, eventsB.get(0).getMessage().getType());
    }

    /**
     * 测试批量模式失效为每个模式单独广播
     */
    @Test
    public void testInvalidateByPatternBatch_OneMessagePerPattern() {
        nodeA.invalidateByPatternBatch(Arrays.asList("App_Users_*", "App_Orders_*"));

        assertEquals(2, eventsB.size());
    }

    /**
     * 测试追踪只在本地执行，不产生广播
     */
    @Test
    public void testTrackKey_LocalOnly() {
        nodeA.trackKey("Users", "a1");

        assertTrue(eventsB.isEmpty());
        assertTrue(nodeB.getTrackedKeys("Users").isEmpty());
    }

    /**
     * 测试连锁失效把覆盖到的表作为批量消息广播到其他实例
     */
    @Test
    public void testInvalidateWithRelated_PropagatesToPeer() {
        storeB.set("b-users", "v", null);
        storeB.set("b-orders", "v", null);
        storeB.set("b-items", "v", null);
        nodeB.trackKey("Users", "b-users");
        nodeB.trackKey("Orders", "b-orders");
        nodeB.trackKey("Items", "b-items");

        nodeA.invalidateWithRelated("Users", Arrays.asList("Orders"), 3);

        assertNull(storeB.get("b-users"));
        assertNull(storeB.get("b-orders"));
        assertEquals("v", storeB.get("b-items"));
        assertEquals(1, eventsB.size());
        assertEquals(InvalidationMessage.MessageType.BATCH, eventsB.get(0).getMessage().getType());
        assertEquals(Arrays.asList("Users", "Orders"), eventsB.get(0).getMessage().getTableNames());
    }

    /**
     * 测试按 RELATED 表策略失效时，关联关系来自配置并广播到其他实例
     */
    @Test
    public void testRelatedPolicy_PropagatesToPeer() {
        properties.getTablePolicies().add(InvalidationRule.builder()
                .tableName("Users")
                .invalidationType(InvalidationType.RELATED)
                .relatedTables(Collections.singletonList("Orders"))
                .build());
        storeB.set("b-orders", "v", null);
        nodeB.trackKey("Orders", "b-orders");

        properties.findTablePolicy("Users").apply(nodeA, properties.getMaxRelatedDepth());

        assertNull(storeB.get("b-orders"));
    }

    /**
     * 测试重复投递的消息只应用一次
     */
    @Test
    public void testDuplicateDelivery_AppliedOnce() {
        String payload = envelopeFrom("remote-node", InvalidationMessage.table("Users"));

        nodeB.onMessage(payload);
        nodeB.onMessage(payload);

        assertEquals(1, eventsB.size());
    }

    /**
     * 测试应用失败后允许重投再次应用
     */
    @Test
    public void testFailedApply_AllowsRedelivery() {
        CacheInvalidator local = mock(CacheInvalidator.class);
        when(local.invalidate("Users"))
                .thenThrow(new TableArmorException("down", TableArmorException.ErrorKind.BACKEND))
                .thenReturn(InvalidationResult.empty());
        BroadcastingCacheInvalidator node = new BroadcastingCacheInvalidator(local, transport, properties, clock);
        List<InvalidationEvent> events = new ArrayList<>();
        node.addInvalidationListener(events::add);

        String payload = envelopeFrom("remote-node", InvalidationMessage.table("Users"));
        node.onMessage(payload);
        assertTrue(events.isEmpty());

        node.onMessage(payload);
        assertEquals(1, events.size());
        verify(local, times(2)).invalidate("Users");
    }

    /**
     * 测试格式错误的消息被丢弃
     */
    @Test
    public void testMalformedPayload_Dropped() {
        transport.publish(nodeB.getChannel(), "{broken");
        transport.publish(nodeB.getChannel(), "{\"sourceInstanceId\":\"x\",\"message\":{\"type\":\"Nope\"}}");

        assertTrue(eventsB.isEmpty());
        assertTrue(nodeB.isListening());
    }

    /**
     * 测试监听器异常不影响其他监听器
     */
    @Test
    public void testListenerFailureIsolated() {
        nodeB.addInvalidationListener(event -> {
            throw new IllegalStateException("listener broken");
        });
        List<InvalidationEvent> later = new ArrayList<>();
        nodeB.addInvalidationListener(later::add);

        nodeA.invalidate("Users");

        assertEquals(1, eventsB.size());
        assertEquals(1, later.size());
    }

    /**
     * 测试启停幂等，停止后不再接收消息
     */
    @Test
    public void testStartStopListening_Idempotent() {
        nodeB.startListening();
        assertEquals(2, transport.subscriberCount(nodeB.getChannel()));

        nodeB.stopListening();
        nodeB.stopListening();
        assertFalse(nodeB.isListening());
        assertEquals(1, transport.subscriberCount(nodeB.getChannel()));

        nodeA.invalidate("Users");
        assertTrue(eventsB.isEmpty());
    }

    /**
     * 测试静默降级时发布失败不影响本地结果
     */
    @Test
    public void testPublishFailure_Silent() {
        PubSubTransport broken = mock(PubSubTransport.class);
        doThrow(new TableArmorException("redis down", TableArmorException.ErrorKind.BACKEND))
                .when(broken).publish(anyString(), anyString());
        CacheInvalidator local = mock(CacheInvalidator.class);
        when(local.invalidate("Users")).thenReturn(InvalidationResult.empty());

        BroadcastingCacheInvalidator node = new BroadcastingCacheInvalidator(local, broken, properties, clock);

        assertTrue(node.invalidate("Users").isSuccess());
        verify(local).invalidate("Users");
    }

    /**
     * 测试关闭静默降级时发布失败向上抛出
     */
    @Test(expected = TableArmorException.class)
    public void testPublishFailure_Propagates() {
        properties.getErrorHandling().setSilentFallback(false);
        PubSubTransport broken = mock(PubSubTransport.class);
        doThrow(new TableArmorException("redis down", TableArmorException.ErrorKind.BACKEND))
                .when(broken).publish(anyString(), anyString());
        CacheInvalidator local = mock(CacheInvalidator.class);
        when(local.invalidate("Users")).thenReturn(InvalidationResult.empty());

        new BroadcastingCacheInvalidator(local, broken, properties, clock).invalidate("Users");
    }

    /**
     * 测试关闭时停止监听并关闭本地失效器
     */
    @Test
    public void testClose() {
        CacheInvalidator local = mock(CacheInvalidator.class);
        BroadcastingCacheInvalidator node = new BroadcastingCacheInvalidator(local, transport, properties, clock);
        node.startListening();

        node.close();

        assertFalse(node.isListening());
        verify(local).close();
    }
}
