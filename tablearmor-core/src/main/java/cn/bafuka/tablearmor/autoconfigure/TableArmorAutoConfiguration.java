package cn.bafuka.tablearmor.autoconfigure;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.consistency.PubSubTransport;
import cn.bafuka.tablearmor.consistency.impl.BroadcastingCacheInvalidator;
import cn.bafuka.tablearmor.consistency.impl.LocalPubSubTransport;
import cn.bafuka.tablearmor.consistency.impl.RedisPubSubTransport;
import cn.bafuka.tablearmor.consistency.impl.RedissonPubSubTransport;
import cn.bafuka.tablearmor.core.CacheErrorHandler;
import cn.bafuka.tablearmor.core.TableArmorCache;
import cn.bafuka.tablearmor.intelligent.IntelligentCacheManager;
import cn.bafuka.tablearmor.intelligent.impl.DefaultIntelligentCacheManager;
import cn.bafuka.tablearmor.invalidation.CacheInvalidator;
import cn.bafuka.tablearmor.invalidation.impl.DefaultCacheInvalidator;
import cn.bafuka.tablearmor.keygen.CacheKeyGenerator;
import cn.bafuka.tablearmor.keygen.impl.DefaultCacheKeyGenerator;
import cn.bafuka.tablearmor.resilience.CacheCircuitBreaker;
import cn.bafuka.tablearmor.store.CacheStore;
import cn.bafuka.tablearmor.store.impl.CaffeineCacheStore;
import cn.bafuka.tablearmor.store.impl.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * TableArmor 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TableArmorProperties.class)
@ConditionalOnProperty(prefix = "tablearmor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TableArmorAutoConfiguration {

    public TableArmorAutoConfiguration() {
        log.info("TableArmor auto-configuration initializing...");
    }

    /**
     * 缓存存储：存在 RedisTemplate 时使用 Redis，否则使用进程内 Caffeine
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheStore tableArmorCacheStore(TableArmorProperties properties,
                                           ObjectProvider<RedisTemplate<String, Object>> redisTemplate) {
        properties.validate();
        RedisTemplate<String, Object> template = redisTemplate.getIfAvailable();
        if (template != null) {
            log.info("TableArmor 使用 Redis 缓存存储");
            return new RedisCacheStore(template, properties.defaultExpiration());
        }
        log.info("TableArmor 使用 Caffeine 缓存存储");
        return new CaffeineCacheStore(properties.defaultExpiration());
    }

    /**
     * 缓存键生成器
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheKeyGenerator tableArmorKeyGenerator(TableArmorProperties properties) {
        return new DefaultCacheKeyGenerator(properties);
    }

    /**
     * 熔断器
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tablearmor.circuit-breaker", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public CacheCircuitBreaker tableArmorCircuitBreaker(TableArmorProperties properties) {
        return new CacheCircuitBreaker(properties.getCircuitBreaker());
    }

    /**
     * 智能缓存管理器
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tablearmor.hot-key", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public IntelligentCacheManager tableArmorIntelligentCacheManager(TableArmorProperties properties) {
        DefaultIntelligentCacheManager manager = new DefaultIntelligentCacheManager(properties);
        manager.startHotKeyDetection();
        return manager;
    }

    /**
     * 分布式传输层
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "tablearmor.distributed", name = "enabled", havingValue = "true")
    public PubSubTransport tableArmorPubSubTransport(TableArmorProperties properties,
                                                     ObjectProvider<StringRedisTemplate> stringRedisTemplate,
                                                     ObjectProvider<RedisMessageListenerContainer> listenerContainer,
                                                     ObjectProvider<RedissonClient> redissonClient) {
        switch (properties.getDistributed().getTransport()) {
            case REDISSON:
                return new RedissonPubSubTransport(redissonClient.getObject());
            case LOCAL:
                return new LocalPubSubTransport();
            case REDIS:
            default:
                return new RedisPubSubTransport(stringRedisTemplate.getObject(), listenerContainer.getObject());
        }
    }

    /**
     * 缓存失效器：配置了传输层时包装为分布式失效器并开始监听
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CacheInvalidator tableArmorCacheInvalidator(TableArmorProperties properties,
                                                       CacheStore cacheStore,
                                                       CacheKeyGenerator keyGenerator,
                                                       @Autowired(required = false) CacheErrorHandler errorHandler,
                                                       @Autowired(required = false) PubSubTransport transport) {
        DefaultCacheInvalidator local = new DefaultCacheInvalidator(cacheStore, keyGenerator, properties, errorHandler);
        if (transport == null) {
            return local;
        }

        BroadcastingCacheInvalidator distributed = new BroadcastingCacheInvalidator(local, transport, properties);
        distributed.startListening();
        return distributed;
    }

    /**
     * 缓存门面
     */
    @Bean
    @ConditionalOnMissingBean
    public TableArmorCache tableArmorCache(TableArmorProperties properties,
                                           CacheStore cacheStore,
                                           CacheKeyGenerator keyGenerator,
                                           CacheInvalidator invalidator,
                                           @Autowired(required = false) CacheCircuitBreaker circuitBreaker,
                                           @Autowired(required = false) IntelligentCacheManager intelligentManager) {
        return new TableArmorCache(properties, cacheStore, keyGenerator, invalidator, circuitBreaker,
                intelligentManager);
    }
}
