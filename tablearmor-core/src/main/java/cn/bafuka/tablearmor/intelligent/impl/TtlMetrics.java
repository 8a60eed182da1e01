package cn.bafuka.tablearmor.intelligent.impl;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个键的命中指标，只统计 HIT / MISS
 */
final class TtlMetrics {

    private final AtomicLong hitCount = new AtomicLong();

    private final AtomicLong missCount = new AtomicLong();

    private final AtomicLong totalAccess = new AtomicLong();

    void recordHit() {
        hitCount.incrementAndGet();
        totalAccess.incrementAndGet();
    }

    void recordMiss() {
        missCount.incrementAndGet();
        totalAccess.incrementAndGet();
    }

    long getHitCount() {
        return hitCount.get();
    }

    long getMissCount() {
        return missCount.get();
    }

    double hitRatio() {
        long total = totalAccess.get();
        return total == 0 ? 0.0 : (double) hitCount.get() / total;
    }
}
