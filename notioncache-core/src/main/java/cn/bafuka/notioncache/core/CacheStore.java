package cn.bafuka.notioncache.core;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 缓存存储核心接口
 * 带命名空间的 key -> (value, expiresAt) 表，支持 TTL 过期、模式失效和命中统计
 *
 * @param <V> 缓存值类型
 */
public interface CacheStore<V> {

    /**
     * 获取缓存值
     * 条目存在且未过期时返回；读到已过期条目时顺便删除（惰性过期）
     *
     * @param key 缓存键（不含命名空间）
     * @return 缓存值，不存在或已过期返回 null
     */
    V get(String key);

    /**
     * 写入缓存，无条件覆盖已有条目
     *
     * @param key   缓存键（不含命名空间）
     * @param value 缓存值，null 会被忽略
     * @param ttl   存活时间，null 表示使用默认 TTL
     */
    void set(String key, V value, Duration ttl);

    /**
     * 删除单个缓存条目
     *
     * @param key 缓存键（不含命名空间）
     * @return 条目是否存在
     */
    boolean invalidate(String key);

    /**
     * 按正则删除缓存
     * 在完整键（含命名空间前缀）上做 find 匹配
     *
     * @param pattern 正则
     * @return 删除的条目数
     */
    int invalidatePattern(Pattern pattern);

    /**
     * 按正则字符串删除缓存
     *
     * @param regex 正则表达式
     * @return 删除的条目数
     */
    default int invalidatePattern(String regex) {
        return invalidatePattern(Pattern.compile(regex));
    }

    /**
     * 删除所有完整键满足条件的条目
     *
     * @param predicate 作用于完整键（含命名空间前缀）的条件
     * @return 删除的条目数
     */
    int invalidateIf(Predicate<String> predicate);

    /**
     * 清空当前命名空间下的全部缓存，并重置统计
     *
     * @return 删除的条目数
     */
    int clear();

    /**
     * 主动清理所有已过期条目
     *
     * @return 清理的条目数
     */
    int removeExpired();

    /**
     * 获取统计信息快照
     *
     * @return 统计信息
     */
    CacheStats getStats();

    /**
     * 重置命中、未命中等计数器
     */
    void resetStats();

    /**
     * 启用缓存
     */
    void enable();

    /**
     * 禁用缓存，已有条目保留
     */
    void disable();

    boolean isEnabled();

    String getNamespace();

    Duration getDefaultTtl();
}
