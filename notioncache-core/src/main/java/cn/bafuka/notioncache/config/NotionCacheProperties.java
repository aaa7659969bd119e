package cn.bafuka.notioncache.config;

import cn.bafuka.notioncache.model.TtlPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * NotionCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "notioncache")
public class NotionCacheProperties {

    /**
     * 是否启用自动配置
     */
    private boolean enabled = true;

    /**
     * 缓存配置
     */
    private Cache cache = new Cache();

    /**
     * 远程接口配置
     */
    private Api api = new Api();

    @Data
    public static class Cache {

        /**
         * 缓存开关的初始状态
         */
        private boolean enabled = true;

        /**
         * 命名空间
         */
        private String namespace = "notion-workspace-manager";

        /**
         * 默认 TTL
         */
        private Duration defaultTtl = Duration.ofMinutes(5);

        /**
         * 是否合并同一键的并发未命中
         */
        private boolean singleFlight = false;

        /**
         * 过期清理间隔，0 表示不启动后台清理
         */
        private Duration sweepInterval = Duration.ZERO;

        /**
         * TTL 档位
         */
        private TtlPolicy ttl = new TtlPolicy();
    }

    @Data
    public static class Api {

        private String baseUrl = "https://api.notion.com/v1";

        private String version = "2022-06-28";

        /**
         * API Token，设置后优先于 configFile
         */
        private String token;

        /**
         * 兼容旧版工具的 config.json 路径
         */
        private String configFile = "config.json";

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
