package cn.bafuka.notioncache.autoconfigure;

import cn.bafuka.notioncache.client.NotionApiTransport;
import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.client.impl.RestTemplateNotionApiTransport;
import cn.bafuka.notioncache.config.NotionCacheProperties;
import cn.bafuka.notioncache.core.CacheStore;
import cn.bafuka.notioncache.dataplane.FetchCoordinator;
import cn.bafuka.notioncache.dataplane.impl.CaffeineCacheStore;
import cn.bafuka.notioncache.dataplane.impl.DefaultFetchCoordinator;
import cn.bafuka.notioncache.dataplane.impl.ExpirySweeper;
import cn.bafuka.notioncache.spi.impl.ChainedCredentialSource;
import cn.bafuka.notioncache.spi.impl.JsonFileCredentialSource;
import cn.bafuka.notioncache.spi.impl.PropertiesCredentialSource;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;

/**
 * NotionCache 自动配置类
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(NotionCacheProperties.class)
@ConditionalOnProperty(prefix = "notioncache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotionCacheAutoConfiguration {

    public NotionCacheAutoConfiguration() {
        log.info("NotionCache auto-configuration initializing...");
    }

    /**
     * 缓存存储
     */
    @Bean
    @ConditionalOnMissingBean
    public CacheStore<JSONObject> notionCacheStore(NotionCacheProperties properties) {
        NotionCacheProperties.Cache config = properties.getCache();
        CaffeineCacheStore<JSONObject> store =
                new CaffeineCacheStore<>(config.getNamespace(), config.getDefaultTtl());
        if (!config.isEnabled()) {
            store.disable();
        }
        return store;
    }

    /**
     * 过期清理器（仅当 sweep-interval > 0 时创建）
     */
    @Bean(destroyMethod = "shutdown")
    @Conditional(SweepIntervalCondition.class)
    @ConditionalOnMissingBean
    public ExpirySweeper expirySweeper(CacheStore<JSONObject> notionCacheStore, NotionCacheProperties properties) {
        ExpirySweeper sweeper = new ExpirySweeper(notionCacheStore, properties.getCache().getSweepInterval());
        sweeper.start();
        return sweeper;
    }

    /**
     * 取数协调器
     */
    @Bean
    @ConditionalOnMissingBean
    public FetchCoordinator<JSONObject> notionFetchCoordinator(CacheStore<JSONObject> notionCacheStore,
                                                               NotionCacheProperties properties) {
        return new DefaultFetchCoordinator<>(notionCacheStore, properties.getCache().isSingleFlight());
    }

    /**
     * 凭据来源：配置属性优先，其次 config.json
     */
    @Bean
    @ConditionalOnMissingBean
    public ChainedCredentialSource notionCredentialSource(NotionCacheProperties properties) {
        return new ChainedCredentialSource(Arrays.asList(
                new PropertiesCredentialSource(properties),
                new JsonFileCredentialSource(Paths.get(properties.getApi().getConfigFile()))
        ));
    }

    /**
     * 传输层
     */
    @Bean
    @ConditionalOnMissingBean
    public NotionApiTransport notionApiTransport(NotionCacheProperties properties,
                                                 ChainedCredentialSource notionCredentialSource) {
        NotionCacheProperties.Api api = properties.getApi();

        // HttpURLConnection 不支持 PATCH，使用 HttpComponents
        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) api.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) api.getReadTimeout().toMillis());

        return new RestTemplateNotionApiTransport(
                new RestTemplate(requestFactory),
                api.getBaseUrl(),
                notionCredentialSource::requireApiToken,
                api.getVersion()
        );
    }

    /**
     * 工作区客户端
     */
    @Bean
    @ConditionalOnMissingBean
    public NotionClient notionClient(NotionApiTransport notionApiTransport,
                                     FetchCoordinator<JSONObject> notionFetchCoordinator,
                                     NotionCacheProperties properties) {
        return new NotionClient(notionApiTransport, notionFetchCoordinator, properties.getCache().getTtl());
    }

    /**
     * notioncache.cache.sweep-interval 大于 0 时成立
     */
    static class SweepIntervalCondition implements Condition {

        @Override
        public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
            return Binder.get(context.getEnvironment())
                    .bind("notioncache.cache.sweep-interval", Duration.class)
                    .map(interval -> !interval.isZero() && !interval.isNegative())
                    .orElse(false);
        }
    }
}
