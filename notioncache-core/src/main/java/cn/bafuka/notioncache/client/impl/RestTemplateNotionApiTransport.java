package cn.bafuka.notioncache.client.impl;

import cn.bafuka.notioncache.client.NotionApiTransport;
import cn.bafuka.notioncache.exception.NotionApiException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 基于 RestTemplate 的传输层实现
 * 请求体和响应体使用 fastjson 处理，不做重试
 */
@Slf4j
public class RestTemplateNotionApiTransport implements NotionApiTransport {

    /**
     * Notion API 版本请求头
     */
    public static final String VERSION_HEADER = "Notion-Version";

    private final RestTemplate restTemplate;

    private final String baseUrl;

    /**
     * Token 在第一次请求时才解析，没有凭据时只影响真正访问远程接口的命令
     */
    private final Supplier<String> apiToken;

    private final String apiVersion;

    public RestTemplateNotionApiTransport(RestTemplate restTemplate, String baseUrl,
                                          String apiToken, String apiVersion) {
        this(restTemplate, baseUrl, () -> apiToken, apiVersion);
    }

    public RestTemplateNotionApiTransport(RestTemplate restTemplate, String baseUrl,
                                          Supplier<String> apiToken, String apiVersion) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiToken = apiToken;
        this.apiVersion = apiVersion;
    }

    @Override
    public JSONObject exchange(HttpMethod method, String path, Map<String, ?> queryParams, JSONObject body) {
        URI uri = buildUri(path, queryParams);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiToken.get());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(VERSION_HEADER, apiVersion);
        HttpEntity<String> entity = new HttpEntity<>(body == null ? null : body.toJSONString(), headers);

        long startTime = System.currentTimeMillis();
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, method, entity, String.class);
            log.debug("Notion API 请求成功: {} {}, duration={}ms",
                    method, path, System.currentTimeMillis() - startTime);

            String text = response.getBody();
            if (text == null || text.isEmpty()) {
                return new JSONObject();
            }
            return JSON.parseObject(text);
        } catch (RestClientResponseException e) {
            log.debug("Notion API 返回错误: {} {}, status={}", method, path, e.getRawStatusCode());
            throw NotionApiException.fromResponse(e.getRawStatusCode(), e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            log.debug("Notion API 网络错误: {} {}, error={}", method, path, e.getMessage());
            throw NotionApiException.network(e);
        }
    }

    private URI buildUri(String path, Map<String, ?> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path(path);
        if (queryParams != null) {
            queryParams.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.build().encode().toUri();
    }
}
