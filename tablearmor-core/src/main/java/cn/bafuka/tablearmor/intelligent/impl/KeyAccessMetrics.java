package cn.bafuka.tablearmor.intelligent.impl;

import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 单个键的访问指标
 * 写入只发生在 ConcurrentHashMap.compute 内（同一键串行），读取可以并发
 */
final class KeyAccessMetrics {

    /**
     * 访问历史上限
     */
    static final int MAX_HISTORY = 1000;

    private final long firstAccessMillis;

    private volatile long lastAccessMillis;

    private volatile long accessCount;

    private final ConcurrentLinkedDeque<Long> history = new ConcurrentLinkedDeque<>();

    private volatile int historySize;

    KeyAccessMetrics(long nowMillis) {
        this.firstAccessMillis = nowMillis;
        this.lastAccessMillis = nowMillis;
    }

    void recordAccess(long nowMillis) {
        lastAccessMillis = nowMillis;
        accessCount = accessCount + 1;
        history.addLast(nowMillis);
        int size = historySize + 1;
        while (size > MAX_HISTORY && history.pollFirst() != null) {
            size--;
        }
        historySize = size;
    }

    long getFirstAccessMillis() {
        return firstAccessMillis;
    }

    long getLastAccessMillis() {
        return lastAccessMillis;
    }

    long getAccessCount() {
        return accessCount;
    }

    int getHistorySize() {
        return historySize;
    }
}
