package cn.bafuka.notioncache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * TTL 策略
 * 由调用方按键选择档位，缓存本身不做计算
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TtlPolicy {

    /**
     * 列表、查询、搜索、评论
     */
    @Builder.Default
    private Duration listing = Duration.ofMinutes(5);

    /**
     * 单个资源
     */
    @Builder.Default
    private Duration resource = Duration.ofMinutes(15);

    /**
     * 用户与身份
     */
    @Builder.Default
    private Duration identity = Duration.ofHours(1);

    public Duration ttlFor(TtlTier tier) {
        switch (tier) {
            case LISTING:
                return listing;
            case RESOURCE:
                return resource;
            case IDENTITY:
                return identity;
            default:
                throw new IllegalArgumentException("Unknown TTL tier: " + tier);
        }
    }
}
