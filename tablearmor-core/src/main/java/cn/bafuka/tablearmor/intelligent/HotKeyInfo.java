package cn.bafuka.tablearmor.intelligent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 热点键信息（按需计算，不存储）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HotKeyInfo {

    private String key;

    private long accessCount;

    /**
     * 访问速率（次/分钟）
     */
    private double accessRate;

    private Instant firstAccess;

    private Instant lastAccess;

    /**
     * 平均访问间隔
     */
    private Duration averageInterval;

    /**
     * 优先级 = 0.7 * 访问速率 + 0.3 * 最近访问得分
     */
    private double priority;
}
