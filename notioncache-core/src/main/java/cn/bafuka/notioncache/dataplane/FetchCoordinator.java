package cn.bafuka.notioncache.dataplane;

import cn.bafuka.notioncache.core.CacheStore;
import cn.bafuka.notioncache.model.FetchOptions;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 取数协调器接口
 * 先查缓存，未命中时调用生产函数并回写缓存
 *
 * @param <V> 数据类型
 */
public interface FetchCoordinator<V> {

    /**
     * 同步取数
     * 执行流程：绕过/禁用 -> 直接调用生产函数；否则查缓存 -> 未命中调用生产函数 -> 成功后回写
     * 生产函数的异常原样抛出，不会被缓存
     *
     * @param key      缓存键（不含命名空间）
     * @param producer 生产函数
     * @param options  调用选项，可为 null
     * @return 数据
     */
    V getOrFetch(String key, Supplier<? extends V> producer, FetchOptions options);

    /**
     * 异步取数，语义同 {@link #getOrFetch}
     * 生产函数失败时，返回的 future 以生产函数自身的异常失败
     *
     * @param key      缓存键（不含命名空间）
     * @param producer 异步生产函数
     * @param options  调用选项，可为 null
     * @return 数据的 future
     */
    CompletableFuture<V> getOrFetchAsync(String key, Supplier<? extends CompletionStage<V>> producer,
                                         FetchOptions options);

    void enable();

    void disable();

    boolean isEnabled();

    /**
     * 底层缓存存储
     *
     * @return 缓存存储
     */
    CacheStore<V> getCacheStore();
}
