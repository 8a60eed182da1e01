package cn.bafuka.tablearmor.model;

import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 表级失效规则
 * 在配置阶段挂到表上，由失效调用方消费，引擎本身不持久化
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRule {

    /**
     * 表名（唯一标识）
     */
    private String tableName;

    /**
     * 失效类型
     */
    @Builder.Default
    private InvalidationType invalidationType = InvalidationType.ALL;

    /**
     * 通配模式（PATTERN 类型时使用）
     */
    private String pattern;

    /**
     * 关联表（RELATED 类型时使用）
     */
    @Builder.Default
    private List<String> relatedTables = new ArrayList<>();

    /**
     * 连锁失效深度，小于 0 表示使用全局配置
     */
    @Builder.Default
    private int maxDepth = -1;

    /**
     * 按规则类型执行失效
     *
     * @param invalidator  失效器
     * @param defaultDepth 规则未指定深度时使用的连锁深度
     * @return 失效结果
     */
    public InvalidationResult apply(CacheInvalidator invalidator, int defaultDepth) {
        switch (invalidationType) {
            case PATTERN:
                return invalidator.invalidateByPattern(pattern);
            case RELATED:
                return invalidator.invalidateWithRelated(tableName, relatedTables, maxDepth > 0 ? maxDepth : defaultDepth);
            case ALL:
            default:
                return invalidator.invalidate(tableName);
        }
    }

    /**
     * 校验规则
     *
     * @throws IllegalArgumentException 规则无效时
     */
    public void validate() {
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new IllegalArgumentException("Table policy tableName cannot be null or empty");
        }

        if (invalidationType == null) {
            throw new IllegalArgumentException(
                    String.format("invalidationType cannot be null for table %s", tableName));
        }

        if (invalidationType == InvalidationType.PATTERN && (pattern == null || pattern.isEmpty())) {
            throw new IllegalArgumentException(
                    String.format("pattern cannot be null or empty for PATTERN policy of table %s", tableName));
        }

        if (maxDepth == 0) {
            throw new IllegalArgumentException(
                    String.format("maxDepth must be positive or negative (use default) for table %s", tableName));
        }
    }
}
