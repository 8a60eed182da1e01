package cn.bafuka.tablearmor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 失效结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationResult {

    /**
     * 是否成功
     */
    private boolean success;

    /**
     * 尝试删除的键数量
     */
    private int attemptedCount;

    /**
     * 实际删除成功的键数量
     */
    private int invalidatedCount;

    /**
     * 耗时
     */
    @Builder.Default
    private Duration duration = Duration.ZERO;

    /**
     * 错误信息
     */
    private String errorMessage;

    public static InvalidationResult empty() {
        return InvalidationResult.builder().success(true).build();
    }

    public static InvalidationResult failed(String errorMessage, Duration duration) {
        return InvalidationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .duration(duration)
                .build();
    }
}
