package cn.bafuka.notioncache.core;

import com.alibaba.fastjson.JSONObject;
import org.junit.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * CacheKeys 单元测试
 */
public class CacheKeysTest {

    @Test
    public void testOperationOnly() {
        assertEquals("self", CacheKeys.of("self"));
        assertEquals("users", CacheKeys.of("users", null));
    }

    /**
     * 测试参数顺序不影响生成的键
     */
    @Test
    public void testParameterOrderIsIrrelevant() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("query", "roadmap");
        first.put("pageSize", 50);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("pageSize", 50);
        second.put("query", "roadmap");

        assertEquals(CacheKeys.of("search", first), CacheKeys.of("search", second));
        assertEquals("search:pageSize=50&query=roadmap", CacheKeys.of("search", first));
    }

    /**
     * 测试 null 参数被省略
     */
    @Test
    public void testNullParametersOmitted() {
        Map<String, Object> params = new HashMap<>();
        params.put("id", "abc");
        params.put("startCursor", null);

        assertEquals("blocks:id=abc", CacheKeys.of("blocks", params));
        assertEquals("blocks:id=abc", CacheKeys.builder("blocks").param("id", "abc").param("startCursor", null).build());
    }

    @Test
    public void testAllNullParametersCollapseToOperation() {
        Map<String, Object> params = new HashMap<>();
        params.put("startCursor", null);

        assertEquals("users", CacheKeys.of("users", params));
    }

    /**
     * 测试参数值中的分隔符被编码
     */
    @Test
    public void testValuesAreEncoded() {
        String key = CacheKeys.builder("search").param("query", "a&b=c d").build();

        assertEquals("search:query=a%26b%3Dc+d", key);
    }

    /**
     * 测试结构化参数按字段排序后序列化
     */
    @Test
    public void testStructuredValuesAreCanonical() {
        JSONObject first = new JSONObject(true);
        first.put("property", "object");
        first.put("value", "page");
        JSONObject second = new JSONObject(true);
        second.put("value", "page");
        second.put("property", "object");

        String a = CacheKeys.builder("search").param("filter", first).build();
        String b = CacheKeys.builder("search").param("filter", second).build();

        assertEquals(a, b);
        assertTrue(a.startsWith("search:filter="));
    }

    @Test
    public void testDistinctParametersGiveDistinctKeys() {
        assertNotEquals(CacheKeys.builder("page").param("id", "1").build(),
                CacheKeys.builder("page").param("id", "2").build());
        assertNotEquals(CacheKeys.builder("page").param("id", "1").build(),
                CacheKeys.builder("block").param("id", "1").build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyOperationRejected() {
        CacheKeys.of("");
    }
}
