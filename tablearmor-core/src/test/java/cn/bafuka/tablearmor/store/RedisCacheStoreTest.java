package cn.bafuka.tablearmor.store;

import cn.bafuka.tablearmor.exception.TableArmorException;
import cn.bafuka.tablearmor.store.impl.RedisCacheStore;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisKeyCommands;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RedisCacheStore 单元测试
 */
public class RedisCacheStoreTest {

    private RedisCacheStore store;

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    @Mock
    private RedisConnection connection;

    @Mock
    private RedisKeyCommands keyCommands;

    @Mock
    private Cursor<byte[]> cursor;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        store = new RedisCacheStore(redisTemplate, Duration.ofMinutes(30));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    /**
     * 测试未指定 TTL 时使用默认过期时间
     */
    @Test
    public void testSet_DefaultTtl() {
        store.set("k1", "v1", null);

        verify(valueOperations).set("k1", "v1", Duration.ofMinutes(30).toMillis(), TimeUnit.MILLISECONDS);
    }

    @Test
    public void testGetAndExists() {
        when(valueOperations.get("k1")).thenReturn("v1");
        when(redisTemplate.hasKey("k1")).thenReturn(true);
        when(redisTemplate.hasKey("k2")).thenReturn(null);

        assertEquals("v1", store.get("k1"));
        assertTrue(store.exists("k1"));
        assertFalse(store.exists("k2"));
    }

    /**
     * 测试 Redis 异常被包装为 BACKEND 错误
     */
    @Test
    public void testGet_BackendErrorWrapped() {
        when(valueOperations.get("k1")).thenThrow(new RedisConnectionFailureException("down"));

        try {
            store.get("k1");
            fail("Expected TableArmorException");
        } catch (TableArmorException e) {
            assertEquals(TableArmorException.ErrorKind.BACKEND, e.getKind());
            assertTrue(e.getCause() instanceof RedisConnectionFailureException);
        }
    }

    /**
     * 测试按模式删除通过 SCAN 找到键后批量删除
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testRemoveByPattern_UsesScan() {
        doReturn(new StringRedisSerializer()).when(redisTemplate).getKeySerializer();
        when(redisTemplate.execute(any(RedisCallback.class))).thenAnswer(invocation ->
                ((RedisCallback<Object>) invocation.getArgument(0)).doInRedis(connection));
        when(connection.keyCommands()).thenReturn(keyCommands);
        when(keyCommands.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn(
                "App_Users_1".getBytes(StandardCharsets.UTF_8),
                "App_Users_2".getBytes(StandardCharsets.UTF_8));
        when(redisTemplate.delete(anyCollection())).thenReturn(2L);

        long removed = store.removeByPattern("App_Users_*");

        assertEquals(2, removed);
        verify(redisTemplate).delete((Collection<String>) eq(Arrays.asList("App_Users_1", "App_Users_2")));
        verify(cursor).close();
    }

    /**
     * 没有匹配的键时不调用删除
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testRemoveByPattern_NoMatch() {
        doReturn(new StringRedisSerializer()).when(redisTemplate).getKeySerializer();
        when(redisTemplate.execute(any(RedisCallback.class))).thenAnswer(invocation ->
                ((RedisCallback<Object>) invocation.getArgument(0)).doInRedis(connection));
        when(connection.keyCommands()).thenReturn(keyCommands);
        when(keyCommands.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(cursor.hasNext()).thenReturn(false);

        assertEquals(0, store.removeByPattern("Nothing_*"));
        verify(redisTemplate, never()).delete(anyCollection());
    }
}
