package cn.bafuka.notioncache.core;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.serializer.SerializerFeature;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 缓存键构造工具
 * 格式：operation:name1=value1&name2=value2
 * <p>
 * 参数按名称排序，null 参数省略；非标量参数序列化为字段有序的 JSON，
 * 所有参数值做 URL 编码，保证逻辑相同的请求得到完全相同的键
 */
public final class CacheKeys {

    /**
     * 操作名与参数之间的分隔符
     */
    public static final char OPERATION_SEPARATOR = ':';

    private CacheKeys() {
    }

    /**
     * 构造无参数的缓存键
     *
     * @param operation 操作名
     * @return 缓存键
     */
    public static String of(String operation) {
        return of(operation, Collections.emptyMap());
    }

    /**
     * 构造缓存键
     *
     * @param operation 操作名
     * @param params    参数集合，可为 null
     * @return 缓存键
     */
    public static String of(String operation, Map<String, ?> params) {
        if (operation == null || operation.isEmpty()) {
            throw new IllegalArgumentException("Cache key operation must not be empty");
        }
        if (params == null || params.isEmpty()) {
            return operation;
        }

        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ?> entry : new TreeMap<>(params).entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            joiner.add(entry.getKey() + "=" + encodeValue(entry.getValue()));
        }

        if (joiner.length() == 0) {
            return operation;
        }
        return operation + OPERATION_SEPARATOR + joiner;
    }

    /**
     * 创建键构造器
     *
     * @param operation 操作名
     * @return 构造器
     */
    public static Builder builder(String operation) {
        return new Builder(operation);
    }

    /**
     * 把单个参数值编码为键中的文本形式
     *
     * @param value 参数值
     * @return 编码后的文本
     */
    public static String encodeValue(Object value) {
        return URLEncoder.encode(render(value), StandardCharsets.UTF_8);
    }

    private static String render(Object value) {
        if (value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof Enum) {
            return value.toString();
        }
        return JSON.toJSONString(canonicalize(value), SerializerFeature.MapSortField, SerializerFeature.SortField);
    }

    /**
     * 把 Map 递归转为 TreeMap，有序 Map（如有序 JSONObject）不会被 MapSortField 重新排序
     */
    private static Object canonicalize(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(canonicalize(item));
            }
            return items;
        }
        return value;
    }

    /**
     * 缓存键构造器
     */
    public static final class Builder {

        private final String operation;
        private final Map<String, Object> params = new TreeMap<>();

        private Builder(String operation) {
            this.operation = operation;
        }

        public Builder param(String name, Object value) {
            if (value != null) {
                params.put(name, value);
            }
            return this;
        }

        public String build() {
            return of(operation, params);
        }
    }
}
