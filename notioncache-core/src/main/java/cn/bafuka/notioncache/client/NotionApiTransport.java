package cn.bafuka.notioncache.client;

import com.alibaba.fastjson.JSONObject;
import org.springframework.http.HttpMethod;

import java.util.Collections;
import java.util.Map;

/**
 * Notion REST API 传输层接口
 * 负责请求格式化、认证头和错误映射，对缓存层是黑盒
 */
public interface NotionApiTransport {

    /**
     * 发送请求
     *
     * @param method      HTTP 方法
     * @param path        以 / 开头的接口路径，如 /pages/{id}
     * @param queryParams 查询参数，null 值会被跳过
     * @param body        请求体，可为 null
     * @return 响应 JSON
     * @throws cn.bafuka.notioncache.exception.NotionApiException 非 2xx 响应或网络失败
     */
    JSONObject exchange(HttpMethod method, String path, Map<String, ?> queryParams, JSONObject body);

    default JSONObject get(String path) {
        return exchange(HttpMethod.GET, path, Collections.emptyMap(), null);
    }

    default JSONObject get(String path, Map<String, ?> queryParams) {
        return exchange(HttpMethod.GET, path, queryParams, null);
    }

    default JSONObject post(String path, JSONObject body) {
        return exchange(HttpMethod.POST, path, Collections.emptyMap(), body);
    }

    default JSONObject patch(String path, JSONObject body) {
        return exchange(HttpMethod.PATCH, path, Collections.emptyMap(), body);
    }

    default JSONObject delete(String path) {
        return exchange(HttpMethod.DELETE, path, Collections.emptyMap(), null);
    }
}
