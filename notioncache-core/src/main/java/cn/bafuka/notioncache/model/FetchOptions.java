package cn.bafuka.notioncache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * getOrFetch 调用选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchOptions {

    /**
     * 存活时间，null 表示使用缓存存储的默认 TTL
     */
    private Duration ttl;

    /**
     * 是否绕过缓存（不读、不写、不计数）
     */
    private boolean bypassCache;

    public static FetchOptions ttl(Duration ttl) {
        return FetchOptions.builder().ttl(ttl).build();
    }

    public static FetchOptions of(Duration ttl, boolean bypassCache) {
        return new FetchOptions(ttl, bypassCache);
    }
}
