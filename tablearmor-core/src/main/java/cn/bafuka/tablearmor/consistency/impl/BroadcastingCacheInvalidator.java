package cn.bafuka.tablearmor.consistency.impl;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.consistency.DistributedCacheInvalidator;
import cn.bafuka.tablearmor.consistency.InvalidationEnvelope;
import cn.bafuka.tablearmor.consistency.InvalidationEnvelopeCodec;
import cn.bafuka.tablearmor.consistency.InvalidationEvent;
import cn.bafuka.tablearmor.consistency.InvalidationListener;
import cn.bafuka.tablearmor.consistency.InvalidationMessage;
import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.consistency.Subscription;
import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.model.InvalidationResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 分布式失效器实现
 * 包装本地失效器和发布/订阅传输，频道为 {namespace}:invalidation
 *
 * 接收端：自己发出的消息直接丢弃；近期已应用过的 correlationId 丢弃；其余在本地应用后通知监听器
 */
@Slf4j
public class BroadcastingCacheInvalidator implements DistributedCacheInvalidator {

    private static final String CHANNEL_SUFFIX = ":invalidation";

    /**
     * 本地失效器
     */
    private final CacheInvalidator localInvalidator;

    /**
     * 传输层
     */
    private final PubSubTransport transport;

    private final TableArmorProperties properties;

    private final Clock clock;

    private final String instanceId;

    private final String channel;

    /**
     * 近期已应用的 correlationId
     */
    private final Cache<String, Boolean> appliedCorrelationIds;

    private final List<InvalidationListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 串行化 start/stop
     */
    private final ReentrantLock subscriptionLock = new ReentrantLock();

    private volatile Subscription subscription;

    public BroadcastingCacheInvalidator(CacheInvalidator localInvalidator,
                                        PubSubTransport transport,
                                        TableArmorProperties properties) {
        this(localInvalidator, transport, properties, Clock.systemUTC());
    }

    public BroadcastingCacheInvalidator(CacheInvalidator localInvalidator,
                                        PubSubTransport transport,
                                        TableArmorProperties properties,
                                        Clock clock) {
        this.localInvalidator = localInvalidator;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = generateInstanceId();
        this.channel = properties.getNamespace() + CHANNEL_SUFFIX;

        TableArmorProperties.Distributed distributed = properties.getDistributed();
        this.appliedCorrelationIds = Caffeine.newBuilder()
                .maximumSize(distributed.getDedupCapacity())
                .expireAfterWrite(distributed.getDedupWindow())
                .build();

        log.info("分布式失效器初始化: instanceId={}, channel={}", instanceId, channel);
    }

    @Override
    public String getInstanceId() {
        return instanceId;
    }

    public String getChannel() {
        return channel;
    }

    @Override
    public void startListening() {
        subscriptionLock.lock();
        try {
            if (subscription != null) {
                log.debug("已在监听失效频道，跳过: channel={}", channel);
                return;
            }
            subscription = transport.subscribe(channel, this::onMessage);
            log.info("开始监听失效频道: channel={}, instanceId={}", channel, instanceId);
        } finally {
            subscriptionLock.unlock();
        }
    }

    @Override
    public void stopListening() {
        subscriptionLock.lock();
        try {
            if (subscription == null) {
                return;
            }
            transport.unsubscribe(subscription);
            subscription = null;
            log.info("停止监听失效频道: channel={}", channel);
        } finally {
            subscriptionLock.unlock();
        }
    }

    @Override
    public boolean isListening() {
        return subscription != null;
    }

    // ---- 本地 + 广播 ----

    @Override
    public InvalidationResult broadcastInvalidation(String tableName) {
        InvalidationResult result = localInvalidator.invalidate(tableName);
        publish(InvalidationMessage.table(tableName));
        return result;
    }

    @Override
    public InvalidationResult broadcastInvalidationByPattern(String pattern) {
        InvalidationResult result = localInvalidator.invalidateByPattern(pattern);
        publish(InvalidationMessage.pattern(pattern));
        return result;
    }

    @Override
    public InvalidationResult broadcastBatchInvalidation(Collection<String> tableNames) {
        InvalidationResult result = localInvalidator.invalidateBatch(tableNames);
        publish(InvalidationMessage.batch(tableNames));
        return result;
    }

    @Override
    public InvalidationResult invalidate(String tableName) {
        return broadcastInvalidation(tableName);
    }

    @Override
    public InvalidationResult invalidateByPattern(String pattern) {
        return broadcastInvalidationByPattern(pattern);
    }

    @Override
    public InvalidationResult invalidateBatch(Collection<String> tableNames) {
        if (tableNames == null || tableNames.isEmpty()) {
            return InvalidationResult.empty();
        }
        return broadcastBatchInvalidation(tableNames);
    }

    /**
     * 本地按关联关系连锁失效，实际覆盖的表作为一条批量消息广播，接收端不再展开关联
     */
    @Override
    public InvalidationResult invalidateWithRelated(String tableName, Collection<String> relatedTables, int maxDepth) {
        List<String> tables = localInvalidator.resolveRelatedTables(tableName, relatedTables, maxDepth);
        InvalidationResult result = localInvalidator.invalidateWithRelated(tableName, relatedTables, maxDepth);
        if (!tables.isEmpty()) {
            publish(InvalidationMessage.batch(tables));
        }
        return result;
    }

    /**
     * 每个模式单独广播
     */
    @Override
    public InvalidationResult invalidateByPatternBatch(Collection<String> patterns) {
        InvalidationResult result = localInvalidator.invalidateByPatternBatch(patterns);
        if (patterns != null) {
            for (String pattern : patterns) {
                publish(InvalidationMessage.pattern(pattern));
            }
        }
        return result;
    }

    // ---- 仅本地 ----

    @Override
    public void trackKey(String tableName, String cacheKey) {
        localInvalidator.trackKey(tableName, cacheKey);
    }

    @Override
    public void trackKey(Collection<String> tableNames, String cacheKey) {
        localInvalidator.trackKey(tableNames, cacheKey);
    }

    @Override
    public Set<String> getTrackedKeys(String tableName) {
        return localInvalidator.getTrackedKeys(tableName);
    }

    @Override
    public List<String> resolveRelatedTables(String tableName, Collection<String> relatedTables, int maxDepth) {
        return localInvalidator.resolveRelatedTables(tableName, relatedTables, maxDepth);
    }

    @Override
    public void addInvalidationListener(InvalidationListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeInvalidationListener(InvalidationListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        stopListening();
        localInvalidator.close();
        log.info("分布式失效器已关闭: instanceId={}", instanceId);
    }

    private void publish(InvalidationMessage message) {
        InvalidationEnvelope envelope = InvalidationEnvelope.builder()
                .sourceInstanceId(instanceId)
                .message(message)
                .timestamp(clock.instant())
                .build();

        try {
            transport.publish(channel, InvalidationEnvelopeCodec.encode(envelope));
            if (properties.getLogging().isLogInvalidation()) {
                log.info("已发送失效广播: type={}, tables={}, pattern={}, correlationId={}",
                        message.getType(), message.getTableNames(), message.getPattern(), message.getCorrelationId());
            }
        } catch (RuntimeException e) {
            if (!properties.getErrorHandling().isSilentFallback()) {
                throw e;
            }
            log.error("发送失效广播失败: type={}, tables={}, pattern={}",
                    message.getType(), message.getTableNames(), message.getPattern(), e);
        }
    }

    /**
     * 处理收到的消息，任何异常都不会抛出到传输层
     */
    void onMessage(String payload) {
        InvalidationEnvelope envelope;
        try {
            envelope = InvalidationEnvelopeCodec.decode(payload);
        } catch (RuntimeException e) {
            log.error("失效消息解码失败，丢弃: payload={}", payload, e);
            return;
        }

        if (instanceId.equals(envelope.getSourceInstanceId())) {
            log.debug("忽略本实例发出的失效消息: correlationId={}", envelope.getMessage().getCorrelationId());
            return;
        }

        String correlationId = envelope.getMessage().getCorrelationId();
        if (appliedCorrelationIds.asMap().putIfAbsent(correlationId, Boolean.TRUE) != null) {
            log.debug("忽略重复的失效消息: correlationId={}", correlationId);
            return;
        }

        try {
            applyLocally(envelope.getMessage());
        } catch (RuntimeException e) {
            // 允许重投时重新应用
            appliedCorrelationIds.invalidate(correlationId);
            log.error("应用远端失效消息失败: source={}, correlationId={}",
                    envelope.getSourceInstanceId(), correlationId, e);
            return;
        }

        InvalidationEvent event = InvalidationEvent.builder()
                .sourceInstanceId(envelope.getSourceInstanceId())
                .message(envelope.getMessage())
                .sentAt(envelope.getTimestamp())
                .appliedAt(clock.instant())
                .build();
        for (InvalidationListener listener : listeners) {
            try {
                listener.onInvalidation(event);
            } catch (Exception e) {
                log.error("失效监听器执行失败: listener={}", listener, e);
            }
        }
    }

    private void applyLocally(InvalidationMessage message) {
        if (properties.getLogging().isLogInvalidation()) {
            log.info("应用远端失效消息: type={}, tables={}, pattern={}",
                    message.getType(), message.getTableNames(), message.getPattern());
        }

        switch (message.getType()) {
            case TABLE:
                for (String tableName : message.getTableNames()) {
                    localInvalidator.invalidate(tableName);
                }
                break;
            case PATTERN:
                localInvalidator.invalidateByPattern(message.getPattern());
                break;
            case BATCH:
                localInvalidator.invalidateBatch(message.getTableNames());
                break;
            default:
                log.warn("未知的失效消息类型: {}", message.getType());
        }
    }

    private static String generateInstanceId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("获取主机名失败，使用默认值", e);
            host = "unknown-host";
        }

        // RuntimeMXBean 名称形如 pid@hostname
        String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
        int at = runtimeName.indexOf('@');
        String pid = at > 0 ? runtimeName.substring(0, at) : runtimeName;

        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return host + "_" + pid + "_" + suffix;
    }
}
