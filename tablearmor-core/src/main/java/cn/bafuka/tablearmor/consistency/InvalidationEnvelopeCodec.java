package cn.bafuka.tablearmor.consistency;

import cn.bafuka.tablearmor.exception.TableArmorException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.serializer.SerializerFeature;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 信封编解码
 * <pre>
 * {"sourceInstanceId": "...",
 *  "message": {"type": "Table|Pattern|Batch", "tableNames": [...], "pattern": null, "correlationId": "..."},
 *  "timestamp": "2024-01-01T00:00:00Z"}
 * </pre>
 */
public final class InvalidationEnvelopeCodec {

    private InvalidationEnvelopeCodec() {
    }

    public static String encode(InvalidationEnvelope envelope) {
        InvalidationMessage message = envelope.getMessage();

        JSONObject body = new JSONObject(true);
        body.put("type", message.getType().getWireName());
        body.put("tableNames", message.getTableNames() == null ? new ArrayList<String>() : message.getTableNames());
        body.put("pattern", message.getPattern());
        body.put("correlationId", message.getCorrelationId());

        JSONObject root = new JSONObject(true);
        root.put("sourceInstanceId", envelope.getSourceInstanceId());
        root.put("message", body);
        root.put("timestamp", envelope.getTimestamp() == null ? null : envelope.getTimestamp().toString());

        return JSON.toJSONString(root, SerializerFeature.WriteMapNullValue);
    }

    /**
     * 解码信封
     *
     * @throws TableArmorException SERIALIZATION 类别，内容不是合法信封时
     */
    public static InvalidationEnvelope decode(String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            throw serializationError("Empty invalidation payload", null);
        }

        try {
            JSONObject root = JSON.parseObject(payload);
            if (root == null) {
                throw serializationError("Invalidation payload is not a JSON object", null);
            }

            String sourceInstanceId = root.getString("sourceInstanceId");
            if (sourceInstanceId == null || sourceInstanceId.isEmpty()) {
                throw serializationError("Missing sourceInstanceId", null);
            }

            JSONObject body = root.getJSONObject("message");
            if (body == null) {
                throw serializationError("Missing message", null);
            }

            InvalidationMessage.MessageType type = InvalidationMessage.MessageType.fromWireName(body.getString("type"));
            String correlationId = body.getString("correlationId");
            if (correlationId == null || correlationId.isEmpty()) {
                throw serializationError("Missing correlationId", null);
            }

            List<String> tableNames = new ArrayList<>();
            JSONArray tables = body.getJSONArray("tableNames");
            if (tables != null) {
                tableNames.addAll(tables.toJavaList(String.class));
            }

            String pattern = body.getString("pattern");
            if (type == InvalidationMessage.MessageType.PATTERN && (pattern == null || pattern.isEmpty())) {
                throw serializationError("Missing pattern for Pattern message", null);
            }

            String timestamp = root.getString("timestamp");

            return InvalidationEnvelope.builder()
                    .sourceInstanceId(sourceInstanceId)
                    .message(InvalidationMessage.builder()
                            .type(type)
                            .tableNames(tableNames)
                            .pattern(pattern)
                            .correlationId(correlationId)
                            .build())
                    .timestamp(timestamp == null ? null : Instant.parse(timestamp))
                    .build();
        } catch (TableArmorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw serializationError("Malformed invalidation payload: " + e.getMessage(), e);
        }
    }

    private static TableArmorException serializationError(String message, Throwable cause) {
        return new TableArmorException(message, cause, TableArmorException.ErrorKind.SERIALIZATION);
    }
}
