package cn.bafuka.notioncache.spi.impl;

import cn.bafuka.notioncache.spi.CredentialSource;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 本地 config.json 凭据来源
 * 同时支持新格式 {"notion":{"apiToken":...}} 和旧版 MCP 格式
 * {"mcpServer":{"env":{"NOTION_API_TOKEN":...}}}
 */
@Slf4j
public class JsonFileCredentialSource implements CredentialSource {

    private final Path configFile;

    public JsonFileCredentialSource(Path configFile) {
        this.configFile = configFile;
    }

    @Override
    public String getApiToken() {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            log.debug("配置文件不存在: {}", configFile);
            return null;
        }

        JSONObject config;
        try {
            config = JSON.parseObject(Files.readString(configFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + configFile, e);
        } catch (JSONException e) {
            throw new IllegalStateException("Invalid JSON in " + configFile, e);
        }
        if (config == null) {
            return null;
        }

        JSONObject notion = config.getJSONObject("notion");
        if (notion != null && StringUtils.hasText(notion.getString("apiToken"))) {
            return notion.getString("apiToken");
        }

        JSONObject mcpServer = config.getJSONObject("mcpServer");
        JSONObject env = mcpServer == null ? null : mcpServer.getJSONObject("env");
        if (env != null && StringUtils.hasText(env.getString("NOTION_API_TOKEN"))) {
            log.info("使用旧版 MCP 格式的凭据: {}", configFile);
            return env.getString("NOTION_API_TOKEN");
        }
        return null;
    }

    @Override
    public String getType() {
        return "json-file";
    }
}
