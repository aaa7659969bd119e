package cn.bafuka.notioncache.dataplane.impl;

import cn.bafuka.notioncache.core.CacheEntry;
import cn.bafuka.notioncache.core.CacheStats;
import cn.bafuka.notioncache.core.CacheStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 缓存存储实现
 * 基于 Caffeine 的并发表，过期由本类按条目自身的 expiresAt 判定（惰性过期），
 * Caffeine 不设容量上限和过期策略
 *
 * @param <V> 缓存值类型
 */
@Slf4j
public class CaffeineCacheStore<V> implements CacheStore<V> {

    /**
     * 命名空间与缓存键之间的分隔符
     */
    public static final String NAMESPACE_SEPARATOR = ":";

    private final String namespace;

    private final Duration defaultTtl;

    /**
     * 时间源（测试中可替换为手动推进的 Ticker）
     */
    private final Ticker ticker;

    /**
     * Key: 完整键（命名空间 + ":" + 缓存键）
     */
    private final Cache<String, CacheEntry<V>> cache;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder writes = new LongAdder();
    private final LongAdder invalidations = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    private volatile boolean enabled = true;

    public CaffeineCacheStore(String namespace, Duration defaultTtl) {
        this(namespace, defaultTtl, Ticker.systemTicker());
    }

    public CaffeineCacheStore(String namespace, Duration defaultTtl, Ticker ticker) {
        if (namespace == null || namespace.isEmpty()) {
            throw new IllegalArgumentException("Cache namespace must not be empty");
        }
        toNanos(defaultTtl);
        this.namespace = namespace;
        this.defaultTtl = defaultTtl;
        this.ticker = ticker;
        this.cache = Caffeine.newBuilder()
                .executor(Runnable::run)
                .build();

        log.info("构建缓存存储: namespace={}, defaultTtl={}", namespace, defaultTtl);
    }

    @Override
    public V get(String key) {
        String fullKey = fullKey(key);
        CacheEntry<V> entry = cache.getIfPresent(fullKey);
        if (entry == null) {
            misses.increment();
            log.debug("缓存未命中: key={}", fullKey);
            return null;
        }

        if (!entry.isFresh(ticker.read())) {
            // 条件删除，避免误删并发写入的新条目
            if (cache.asMap().remove(fullKey, entry)) {
                expirations.increment();
            }
            misses.increment();
            log.debug("缓存已过期: key={}", fullKey);
            return null;
        }

        hits.increment();
        log.debug("缓存命中: key={}", fullKey);
        return entry.getValue();
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        if (value == null) {
            log.debug("忽略 null 值写入: key={}", key);
            return;
        }
        Duration effectiveTtl = ttl == null ? defaultTtl : ttl;
        long ttlNanos = toNanos(effectiveTtl);

        String fullKey = fullKey(key);
        long expiresAt = ticker.read() + ttlNanos;
        cache.put(fullKey, new CacheEntry<>(fullKey, value, expiresAt));
        writes.increment();
        log.debug("缓存写入: key={}, ttl={}", fullKey, effectiveTtl);
    }

    @Override
    public boolean invalidate(String key) {
        String fullKey = fullKey(key);
        boolean removed = cache.asMap().remove(fullKey) != null;
        if (removed) {
            invalidations.increment();
        }
        log.debug("缓存失效: key={}, removed={}", fullKey, removed);
        return removed;
    }

    @Override
    public int invalidatePattern(Pattern pattern) {
        int removed = invalidateIf(fullKey -> pattern.matcher(fullKey).find());
        log.debug("按模式失效: pattern={}, removed={}", pattern.pattern(), removed);
        return removed;
    }

    @Override
    public int invalidateIf(Predicate<String> predicate) {
        ConcurrentMap<String, CacheEntry<V>> map = cache.asMap();
        List<String> matched = new ArrayList<>();
        for (String fullKey : map.keySet()) {
            if (predicate.test(fullKey)) {
                matched.add(fullKey);
            }
        }

        int removed = 0;
        for (String fullKey : matched) {
            if (map.remove(fullKey) != null) {
                removed++;
            }
        }
        invalidations.add(removed);
        return removed;
    }

    @Override
    public int clear() {
        ConcurrentMap<String, CacheEntry<V>> map = cache.asMap();
        int removed = 0;
        for (String fullKey : new ArrayList<>(map.keySet())) {
            if (map.remove(fullKey) != null) {
                removed++;
            }
        }
        resetStats();
        log.info("缓存已清空: namespace={}, removed={}", namespace, removed);
        return removed;
    }

    @Override
    public int removeExpired() {
        long now = ticker.read();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<V>> entry : cache.asMap().entrySet()) {
            if (!entry.getValue().isFresh(now)
                    && cache.asMap().remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        expirations.add(removed);
        if (removed > 0) {
            log.debug("清理过期条目: namespace={}, removed={}", namespace, removed);
        }
        return removed;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.builder()
                .namespace(namespace)
                .enabled(enabled)
                .hits(hits.sum())
                .misses(misses.sum())
                .writes(writes.sum())
                .invalidations(invalidations.sum())
                .expirations(expirations.sum())
                .size(cache.asMap().size())
                .build();
    }

    @Override
    public void resetStats() {
        hits.reset();
        misses.reset();
        writes.reset();
        invalidations.reset();
        expirations.reset();
    }

    @Override
    public void enable() {
        enabled = true;
        log.info("缓存已启用: namespace={}", namespace);
    }

    @Override
    public void disable() {
        enabled = false;
        log.info("缓存已禁用: namespace={}", namespace);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * 拼接完整键
     *
     * @param key 缓存键
     * @return 命名空间 + ":" + 缓存键
     */
    public String fullKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
        return namespace + NAMESPACE_SEPARATOR + key;
    }

    /**
     * 校验 TTL 并换算为纳秒，TTL 必须为正且不超过 Long.MAX_VALUE 纳秒
     */
    private static long toNanos(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        try {
            return ttl.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Cache TTL is too large: " + ttl, e);
        }
    }
}
