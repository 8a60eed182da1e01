package cn.bafuka.tablearmor.keygen.impl;

import cn.bafuka.tablearmor.config.TableArmorProperties;
import cn.bafuka.tablearmor.keygen.CacheKeyGenerator;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 默认缓存键生成器
 * 参数过滤、排序、规范化后序列化为 JSON，使用 FarmHash 64 位指纹并以 base36 编码
 *
 * 内部维护一个有上限的键缓存，写满后新键直接计算不再缓存（不做淘汰）
 */
@Slf4j
public class DefaultCacheKeyGenerator implements CacheKeyGenerator {

    /**
     * 键缓存上限
     */
    static final int MAX_MEMO_SIZE = 1000;

    private static final String CONTROLLER_SUFFIX = "Controller";

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final HashFunction HASH_FUNCTION = Hashing.farmHashFingerprint64();

    private final TableArmorProperties properties;

    /**
     * 请求标识 -> 最终键
     */
    private final Map<RequestId, String> memo = new ConcurrentHashMap<>();

    /**
     * 已缓存数量
     */
    private final AtomicLong memoCount = new AtomicLong();

    public DefaultCacheKeyGenerator(TableArmorProperties properties) {
        this.properties = properties;
    }

    @Override
    public String generateKey(String operationId, String action, Map<String, ?> parameters) {
        String parameterHash = generateParameterHash(parameters);
        RequestId requestId = new RequestId(operationId, action, parameterHash);

        String cached = memo.get(requestId);
        if (cached != null) {
            return cached;
        }

        List<String> parts = prefixParts();
        parts.add(stripControllerSuffix(operationId));
        parts.add(action);
        if (!parameterHash.isEmpty()) {
            parts.add(parameterHash);
        }

        String key = String.join(properties.getKeySeparator(), parts);

        if (memoCount.get() < MAX_MEMO_SIZE && memo.putIfAbsent(requestId, key) == null) {
            memoCount.incrementAndGet();
        }

        if (properties.getLogging().isLogKeyGeneration()) {
            log.debug("生成缓存键: operation={}, action={}, key={}", operationId, action, key);
        }
        return key;
    }

    @Override
    public String generateTrackingKey(String tableName) {
        List<String> parts = prefixParts();
        parts.add(properties.getTrackingPrefix());
        parts.add(tableName);
        return String.join(properties.getKeySeparator(), parts);
    }

    @Override
    public String generateParameterHash(Map<String, ?> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }

        // TreeMap 使用 String.compareTo，即按 UTF-16 码元的序数比较
        Map<String, Object> normalized = new TreeMap<>();
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            if (entry.getKey() == null || isEmptyValue(entry.getValue())) {
                continue;
            }
            normalized.put(entry.getKey(), normalizeValue(entry.getValue()));
        }

        if (normalized.isEmpty()) {
            return "";
        }

        String json = JSON.toJSONString(normalized, SerializerFeature.MapSortField, SerializerFeature.SortField);
        long fingerprint = HASH_FUNCTION.hashString(json, StandardCharsets.UTF_8).asLong();
        return Long.toUnsignedString(fingerprint, 36);
    }

    /**
     * 当前键缓存数量
     */
    public long getMemoSize() {
        return memoCount.get();
    }

    private List<String> prefixParts() {
        List<String> parts = new ArrayList<>(6);
        if (hasText(properties.getNamespace())) {
            parts.add(properties.getNamespace());
        }
        if (hasText(properties.getVersionKey())) {
            parts.add(properties.getVersionKey());
        }
        return parts;
    }

    private static String stripControllerSuffix(String operationId) {
        if (operationId != null && operationId.endsWith(CONTROLLER_SUFFIX)
                && operationId.length() > CONTROLLER_SUFFIX.length()) {
            return operationId.substring(0, operationId.length() - CONTROLLER_SUFFIX.length());
        }
        return operationId;
    }

    static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return value.toString().trim().isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    static Object normalizeValue(Object value) {
        if (value instanceof CharSequence) {
            return value.toString().trim();
        }
        if (value instanceof Date) {
            return DATE_FORMAT.format(((Date) value).toInstant());
        }
        if (value instanceof Calendar) {
            return DATE_FORMAT.format(((Calendar) value).toInstant());
        }
        if (value instanceof Instant) {
            return DATE_FORMAT.format((Instant) value);
        }
        if (value instanceof LocalDateTime) {
            return DATE_FORMAT.format(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime) {
            return DATE_FORMAT.format(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof ZonedDateTime) {
            return DATE_FORMAT.format(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).setScale(2, RoundingMode.HALF_UP).toPlainString();
        }
        return value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * 键缓存的索引，按字段比较，不做字符串拼接
     */
    @Value
    private static class RequestId {
        String operationId;
        String action;
        String parameterHash;
    }
}
