package cn.bafuka.notioncache.spi.impl;

import cn.bafuka.notioncache.spi.CredentialSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 按顺序尝试多个凭据来源，取第一个非空 Token
 */
@Slf4j
public class ChainedCredentialSource implements CredentialSource {

    public static final String MISSING_TOKEN_MESSAGE =
            "Missing Notion API token in config.json (expected notion.apiToken or mcpServer.env.NOTION_API_TOKEN)";

    private final List<CredentialSource> sources;

    public ChainedCredentialSource(List<CredentialSource> sources) {
        this.sources = new ArrayList<>(sources);
    }

    /**
     * 第一次成功解析到的 Token，之后不再读取各个来源
     */
    private volatile String resolvedToken;

    @Override
    public String getApiToken() {
        String token = resolvedToken;
        if (token != null) {
            return token;
        }
        for (CredentialSource source : sources) {
            token = source.getApiToken();
            if (token != null) {
                log.debug("从凭据来源获取到 Token: type={}", source.getType());
                resolvedToken = token;
                return token;
            }
        }
        return null;
    }

    /**
     * 获取 Token，所有来源都没有时抛出异常
     *
     * @return Token
     */
    public String requireApiToken() {
        String token = getApiToken();
        if (token == null) {
            throw new IllegalStateException(MISSING_TOKEN_MESSAGE);
        }
        return token;
    }

    @Override
    public String getType() {
        return "chained";
    }
}
