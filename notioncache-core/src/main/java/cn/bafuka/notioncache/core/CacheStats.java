package cn.bafuka.notioncache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private String namespace;
    private boolean enabled;
    private long hits;
    private long misses;
    private long writes;
    private long invalidations;
    private long expirations;
    private long size;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0），无请求时为 0
     */
    public double hitRate() {
        long requestCount = hits + misses;
        return requestCount == 0 ? 0.0 : (double) hits / requestCount;
    }
}
