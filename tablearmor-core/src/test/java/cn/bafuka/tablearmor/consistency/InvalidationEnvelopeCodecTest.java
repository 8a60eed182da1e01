package cn.bafuka.tablearmor.consistency;

import cn.bafuka.tablearmor.exception.TableArmorException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * InvalidationEnvelopeCodec 单元测试
 */
public class InvalidationEnvelopeCodecTest {

    private static final Instant SENT_AT = Instant.parse("2024-03-01T10:00:00Z");

    /**
     * 测试线上格式的字段与取值
     */
    @Test
    public void testEncode_WireFormat() {
        InvalidationEnvelope envelope = InvalidationEnvelope.builder()
                .sourceInstanceId("host_1_abcd1234")
                .message(InvalidationMessage.builder()
                        .type(InvalidationMessage.MessageType.BATCH)
                        .tableNames(Arrays.asList("Users", "Orders"))
                        .correlationId("c-1")
                        .build())
                .timestamp(SENT_AT)
                .build();

        JSONObject root = JSON.parseObject(InvalidationEnvelopeCodec.encode(envelope));

        assertEquals("host_1_abcd1234", root.getString("sourceInstanceId"));
        assertEquals("2024-03-01T10:00:00Z", root.getString("timestamp"));
        JSONObject message = root.getJSONObject("message");
        assertEquals("Batch", message.getString("type"));
        assertEquals(Arrays.asList("Users", "Orders"), message.getJSONArray("tableNames").toJavaList(String.class));
        assertTrue(message.containsKey("pattern"));
        assertNull(message.get("pattern"));
        assertEquals("c-1", message.getString("correlationId"));
    }

    /**
     * 测试解码模式消息
     */
    @Test
    public void testDecode_PatternMessage() {
        String payload = "{\"sourceInstanceId\":\"node-a\",\"message\":{\"type\":\"Pattern\",\"tableNames\":[],"
                + "\"pattern\":\"App_Users_*\",\"correlationId\":\"c-2\"},\"timestamp\":\"2024-03-01T10:00:00Z\"}";

        InvalidationEnvelope envelope = InvalidationEnvelopeCodec.decode(payload);

        assertEquals("node-a", envelope.getSourceInstanceId());
        assertEquals(InvalidationMessage.MessageType.PATTERN, envelope.getMessage().getType());
        assertEquals("App_Users_*", envelope.getMessage().getPattern());
        assertTrue(envelope.getMessage().getTableNames().isEmpty());
        assertEquals(SENT_AT, envelope.getTimestamp());
    }

    /**
     * 测试编码后解码得到相同的消息
     */
    @Test
    public void testEncodeThenDecode() {
        InvalidationMessage message = InvalidationMessage.table("Users");
        InvalidationEnvelope envelope = InvalidationEnvelope.builder()
                .sourceInstanceId("node-a")
                .message(message)
                .timestamp(SENT_AT)
                .build();

        InvalidationEnvelope decoded = InvalidationEnvelopeCodec.decode(InvalidationEnvelopeCodec.encode(envelope));

        assertEquals(envelope, decoded);
    }

    /**
     * 测试非 JSON 内容
     */
    @Test
    public void testDecode_NotJson() {
        assertSerializationError("not json at all");
    }

    /**
     * 测试空内容
     */
    @Test
    public void testDecode_Empty() {
        assertSerializationError("  ");
        assertSerializationError(null);
    }

    /**
     * 测试未知消息类型
     */
    @Test
    public void testDecode_UnknownType() {
        assertSerializationError("{\"sourceInstanceId\":\"a\",\"message\":{\"type\":\"Everything\","
                + "\"correlationId\":\"c\"}}");
    }

    /**
     * 测试缺少必需字段
     */
    @Test
    public void testDecode_MissingFields() {
        assertSerializationError("{\"message\":{\"type\":\"Table\",\"tableNames\":[\"T\"],\"correlationId\":\"c\"}}");
        assertSerializationError("{\"sourceInstanceId\":\"a\"}");
        assertSerializationError("{\"sourceInstanceId\":\"a\",\"message\":{\"type\":\"Table\",\"tableNames\":[\"T\"]}}");
        assertSerializationError("{\"sourceInstanceId\":\"a\",\"message\":{\"type\":\"Pattern\",\"correlationId\":\"c\"}}");
    }

    /**
     * 测试非法时间戳
     */
    @Test
    public void testDecode_BadTimestamp() {
        assertSerializationError("{\"sourceInstanceId\":\"a\",\"message\":{\"type\":\"Table\",\"tableNames\":[\"T\"],"
                + "\"correlationId\":\"c\"},\"timestamp\":\"yesterday\"}");
    }

    private static void assertSerializationError(String payload) {
        try {
            InvalidationEnvelopeCodec.decode(payload);
            fail("Expected TableArmorException for payload: " + payload);
        } catch (TableArmorException e) {
            assertEquals(TableArmorException.ErrorKind.SERIALIZATION, e.getKind());
        }
    }
}
