package cn.bafuka.tablearmor.consistency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 收到并已在本地应用的远端失效事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationEvent {

    private String sourceInstanceId;

    private InvalidationMessage message;

    /**
     * 发送时间
     */
    private Instant sentAt;

    /**
     * 本地应用时间
     */
    private Instant appliedAt;
}
