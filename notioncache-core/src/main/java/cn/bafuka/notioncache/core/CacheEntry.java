package cn.bafuka.notioncache.core;

import lombok.Getter;

/**
 * 缓存条目
 * expiresAtNanos 基于 Ticker 读数，与系统时钟无关
 *
 * @param <V> 缓存值类型
 */
@Getter
public final class CacheEntry<V> {

    private final String key;
    private final V value;
    private final long expiresAtNanos;

    public CacheEntry(String key, V value, long expiresAtNanos) {
        this.key = key;
        this.value = value;
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * 判断在给定时刻是否仍然有效（now <= expiresAt）
     *
     * @param nowNanos Ticker 当前读数
     * @return 未过期返回 true
     */
    public boolean isFresh(long nowNanos) {
        return nowNanos - expiresAtNanos <= 0;
    }
}
