package cn.bafuka.notioncache.spi.impl;

import cn.bafuka.notioncache.config.NotionCacheProperties;
import cn.bafuka.notioncache.spi.CredentialSource;
import org.springframework.util.StringUtils;

/**
 * 从 notioncache.api.token 读取凭据
 */
public class PropertiesCredentialSource implements CredentialSource {

    private final NotionCacheProperties properties;

    public PropertiesCredentialSource(NotionCacheProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getApiToken() {
        if (properties == null || properties.getApi() == null) {
            return null;
        }
        String token = properties.getApi().getToken();
        return StringUtils.hasText(token) ? token : null;
    }

    @Override
    public String getType() {
        return "properties";
    }
}
