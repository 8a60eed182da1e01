package cn.bafuka.tablearmor.store;

import cn.bafuka.tablearmor.store.impl.CaffeineCacheStore;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * CaffeineCacheStore 单元测试
 */
public class CaffeineCacheStoreTest {

    private CaffeineCacheStore store;

    @Before
    public void setUp() {
        store = new CaffeineCacheStore(Duration.ofMinutes(30));
    }

    /**
     * 测试基本的 set/get/remove
     */
    @Test
    public void testSetGetRemove() {
        store.set("k1", "v1", Duration.ofMinutes(5));

        assertEquals("v1", store.get("k1"));
        assertTrue(store.exists("k1"));

        store.remove("k1");
        assertNull(store.get("k1"));
        assertFalse(store.exists("k1"));

        // 删除不存在的键为空操作
        store.remove("missing");
    }

    /**
     * 测试按模式删除：* 匹配任意串，? 匹配单个字符，. 按字面处理
     */
    @Test
    public void testRemoveByPattern() {
        store.set("App_Users_GetUser_1", "a", null);
        store.set("App_Users_GetUser_2", "b", null);
        store.set("App_Orders_List", "c", null);
        store.set("AppXUsers", "d", null);

        long removed = store.removeByPattern("App_Users_*");

        assertEquals(2, removed);
        assertNull(store.get("App_Users_GetUser_1"));
        assertNull(store.get("App_Users_GetUser_2"));
        assertEquals("c", store.get("App_Orders_List"));
        assertEquals("d", store.get("AppXUsers"));
    }

    /**
     * 测试 ? 与字面量 .
     */
    @Test
    public void testRemoveByPattern_SingleCharAndLiteralDot() {
        store.set("v1.key", "a", null);
        store.set("v1xkey", "b", null);
        store.set("v2.key", "c", null);

        assertEquals(2, store.removeByPattern("v?.key"));
        assertEquals("b", store.get("v1xkey"));
    }

    /**
     * 测试按模式删除区分大小写且整串匹配
     */
    @Test
    public void testRemoveByPattern_AnchoredAndCaseSensitive() {
        store.set("users_1", "a", null);
        store.set("Users_1", "b", null);
        store.set("xusers_1", "c", null);

        assertEquals(1, store.removeByPattern("users_*"));
        assertEquals("b", store.get("Users_1"));
        assertEquals("c", store.get("xusers_1"));
    }

    /**
     * 测试 null 键和值被忽略
     */
    @Test
    public void testNullValueIgnored() {
        store.set("k", null, null);
        assertFalse(store.exists("k"));
        assertEquals(0, store.removeByPattern(""));
    }

    /**
     * 测试存储集合值
     */
    @Test
    public void testCollectionValue() {
        List<String> keys = Arrays.asList("a", "b");
        store.set("tracking", keys, Duration.ofHours(1));
        assertEquals(keys, store.get("tracking"));
    }
}
