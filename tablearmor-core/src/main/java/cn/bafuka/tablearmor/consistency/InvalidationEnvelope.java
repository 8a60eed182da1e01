package cn.bafuka.tablearmor.consistency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 线上信封：携带发送者实例 ID，用于回声抑制
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationEnvelope {

    private String sourceInstanceId;

    private InvalidationMessage message;

    private Instant timestamp;
}
