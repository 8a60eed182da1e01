package cn.bafuka.tablearmor.consistency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 失效消息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationMessage {

    private MessageType type;

    @Builder.Default
    private List<String> tableNames = new ArrayList<>();

    /**
     * 通配模式（PATTERN 类型时使用）
     */
    private String pattern;

    /**
     * 关联 ID，用于接收端去重
     */
    private String correlationId;

    public static InvalidationMessage table(String tableName) {
        return InvalidationMessage.builder()
                .type(MessageType.TABLE)
                .tableNames(new ArrayList<>(Collections.singletonList(tableName)))
                .correlationId(newCorrelationId())
                .build();
    }

    public static InvalidationMessage pattern(String pattern) {
        return InvalidationMessage.builder()
                .type(MessageType.PATTERN)
                .pattern(pattern)
                .correlationId(newCorrelationId())
                .build();
    }

    public static InvalidationMessage batch(Collection<String> tableNames) {
        return InvalidationMessage.builder()
                .type(MessageType.BATCH)
                .tableNames(new ArrayList<>(tableNames))
                .correlationId(newCorrelationId())
                .build();
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * 消息类型，wireName 为线上格式中的取值
     */
    public enum MessageType {
        /**
         * 单表失效
         */
        TABLE("Table"),

        /**
         * 按模式失效
         */
        PATTERN("Pattern"),

        /**
         * 批量表失效
         */
        BATCH("Batch");

        private final String wireName;

        MessageType(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static MessageType fromWireName(String wireName) {
            for (MessageType type : values()) {
                if (type.wireName.equals(wireName)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown invalidation message type: " + wireName);
        }
    }
}
