package cn.bafuka.notioncache.dataplane.impl;

import cn.bafuka.notioncache.core.CacheStore;
import cn.bafuka.notioncache.dataplane.FetchCoordinator;
import cn.bafuka.notioncache.model.FetchOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * 取数协调器默认实现
 * <p>
 * 默认不合并并发未命中：同一个键的两个并发调用都会执行生产函数。
 * 开启 singleFlight 后，同一个键同时只有一个生产函数在执行，其余调用等待它的结果
 *
 * @param <V> 数据类型
 */
@Slf4j
public class DefaultFetchCoordinator<V> implements FetchCoordinator<V> {

    private final CacheStore<V> cacheStore;

    private final boolean singleFlight;

    /**
     * 正在执行的生产函数（仅 singleFlight 模式使用）
     * Key: 缓存键
     */
    private final Map<String, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public DefaultFetchCoordinator(CacheStore<V> cacheStore) {
        this(cacheStore, false);
    }

    public DefaultFetchCoordinator(CacheStore<V> cacheStore, boolean singleFlight) {
        this.cacheStore = cacheStore;
        this.singleFlight = singleFlight;
    }

    @Override
    public V getOrFetch(String key, Supplier<? extends V> producer, FetchOptions options) {
        if (shouldBypass(options)) {
            log.debug("绕过缓存: key={}", key);
            return producer.get();
        }

        V cached = cacheStore.get(key);
        if (cached != null) {
            return cached;
        }

        if (singleFlight) {
            return loadShared(key, producer, ttlOf(options));
        }
        return load(key, producer, ttlOf(options));
    }

    @Override
    public CompletableFuture<V> getOrFetchAsync(String key, Supplier<? extends CompletionStage<V>> producer,
                                                FetchOptions options) {
        if (shouldBypass(options)) {
            log.debug("绕过缓存: key={}", key);
            return invokeAsync(producer);
        }

        V cached = cacheStore.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        Duration ttl = ttlOf(options);
        if (!singleFlight) {
            return loadAsync(key, producer, ttl);
        }

        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("复用进行中的加载: key={}", key);
            return follow(existing);
        }

        loadAsync(key, producer, ttl).whenComplete((value, error) -> {
            inFlight.remove(key, mine);
            if (error != null) {
                mine.completeExceptionally(error);
            } else {
                mine.complete(value);
            }
        });
        return mine;
    }

    @Override
    public void enable() {
        cacheStore.enable();
    }

    @Override
    public void disable() {
        cacheStore.disable();
    }

    @Override
    public boolean isEnabled() {
        return cacheStore.isEnabled();
    }

    @Override
    public CacheStore<V> getCacheStore() {
        return cacheStore;
    }

    /**
     * 当前正在执行的生产函数数量
     *
     * @return 数量
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private boolean shouldBypass(FetchOptions options) {
        return (options != null && options.isBypassCache()) || !cacheStore.isEnabled();
    }

    private Duration ttlOf(FetchOptions options) {
        return options == null ? null : options.getTtl();
    }

    private V load(String key, Supplier<? extends V> producer, Duration ttl) {
        V value = producer.get();
        store(key, value, ttl);
        return value;
    }

    /**
     * singleFlight 同步加载：第一个调用者执行生产函数，其余调用者等待同一个结果
     */
    private V loadShared(String key, Supplier<? extends V> producer, Duration ttl) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("等待进行中的加载: key={}", key);
            return await(existing);
        }

        try {
            V value = load(key, producer, ttl);
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private CompletableFuture<V> loadAsync(String key, Supplier<? extends CompletionStage<V>> producer,
                                           Duration ttl) {
        CompletableFuture<V> result = new CompletableFuture<>();
        invokeAsync(producer).whenComplete((value, error) -> {
            if (error != null) {
                log.debug("异步加载失败，不写入缓存: key={}", key);
                result.completeExceptionally(unwrap(error));
                return;
            }
            try {
                store(key, value, ttl);
                result.complete(value);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * 跟随进行中的加载，失败时传递生产函数抛出的原始异常
     */
    private CompletableFuture<V> follow(CompletableFuture<V> leader) {
        CompletableFuture<V> result = new CompletableFuture<>();
        leader.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    private CompletableFuture<V> invokeAsync(Supplier<? extends CompletionStage<V>> producer) {
        CompletableFuture<V> result = new CompletableFuture<>();
        CompletionStage<V> stage;
        try {
            stage = producer.get();
        } catch (RuntimeException | Error e) {
            result.completeExceptionally(e);
            return result;
        }
        if (stage == null) {
            result.completeExceptionally(new NullPointerException("Producer returned a null stage"));
            return result;
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    private void store(String key, V value, Duration ttl) {
        if (value == null) {
            log.warn("生产函数返回 null，不写入缓存: key={}", key);
            return;
        }
        cacheStore.set(key, value, ttl);
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
