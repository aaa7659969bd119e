package cn.bafuka.notioncache.client.impl;

import cn.bafuka.notioncache.exception.NotionApiException;
import com.alibaba.fastjson.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * RestTemplateNotionApiTransport 单元测试
 */
public class RestTemplateNotionApiTransportTest {

    private static final String BASE_URL = "https://api.notion.com/v1";

    private MockRestServiceServer server;

    private RestTemplateNotionApiTransport transport;

    @Before
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        transport = new RestTemplateNotionApiTransport(restTemplate, BASE_URL, "secret_token", "2022-06-28");
    }

    /**
     * 测试认证头和版本头
     */
    @Test
    public void testHeaders() {
        server.expect(requestTo(BASE_URL + "/users/me"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer secret_token"))
                .andExpect(header(RestTemplateNotionApiTransport.VERSION_HEADER, "2022-06-28"))
                .andRespond(withSuccess("{\"object\":\"user\",\"id\":\"bot\"}", MediaType.APPLICATION_JSON));

        JSONObject result = transport.get("/users/me");

        assertEquals("bot", result.getString("id"));
        server.verify();
    }

    /**
     * 测试查询参数按顺序拼接，null 值跳过
     */
    @Test
    public void testQueryParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("start_cursor", "c1");
        params.put("page_size", 50);
        params.put("filter", null);

        server.expect(requestTo(BASE_URL + "/blocks/b1/children?start_cursor=c1&page_size=50"))
                .andRespond(withSuccess("{\"object\":\"list\"}", MediaType.APPLICATION_JSON));

        transport.get("/blocks/b1/children", params);

        server.verify();
    }

    @Test
    public void testPostBody() {
        JSONObject body = new JSONObject(true);
        body.put("query", "roadmap");

        server.expect(requestTo(BASE_URL + "/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string("{\"query\":\"roadmap\"}"))
                .andRespond(withSuccess("{\"object\":\"list\"}", MediaType.APPLICATION_JSON));

        assertEquals("list", transport.post("/search", body).getString("object"));
        server.verify();
    }

    @Test
    public void testPatch() {
        server.expect(requestTo(BASE_URL + "/pages/p1"))
                .andExpect(method(HttpMethod.PATCH))
                .andRespond(withSuccess("{\"id\":\"p1\"}", MediaType.APPLICATION_JSON));

        assertEquals("p1", transport.patch("/pages/p1", new JSONObject()).getString("id"));
        server.verify();
    }

    @Test
    public void testEmptyResponseBody() {
        server.expect(requestTo(BASE_URL + "/blocks/b1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        assertTrue(transport.delete("/blocks/b1").isEmpty());
    }

    /**
     * 测试非 2xx 响应映射为 NotionApiException，保留状态码和响应体
     */
    @Test
    public void testErrorResponse() {
        String body = "{\"object\":\"error\",\"code\":\"object_not_found\"}";
        server.expect(requestTo(BASE_URL + "/pages/missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body(body).contentType(MediaType.APPLICATION_JSON));

        try {
            transport.get("/pages/missing");
            fail("Expected NotionApiException");
        } catch (NotionApiException e) {
            assertEquals(404, e.getStatus());
            assertEquals(body, e.getResponseBody());
            assertEquals(NotionApiException.FailureReason.NOT_FOUND, e.getReason());
            assertEquals("Notion API error (404): " + body, e.getMessage());
        }
    }

    @Test
    public void testRateLimited() {
        server.expect(requestTo(BASE_URL + "/search"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("{}"));

        try {
            transport.post("/search", new JSONObject());
            fail("Expected NotionApiException");
        } catch (NotionApiException e) {
            assertEquals(NotionApiException.FailureReason.RATE_LIMITED, e.getReason());
        }
    }

    /**
     * 测试网络错误映射为 NETWORK
     */
    @Test
    public void testNetworkError() {
        server.expect(requestTo(BASE_URL + "/users"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        try {
            transport.get("/users");
            fail("Expected NotionApiException");
        } catch (NotionApiException e) {
            assertEquals(0, e.getStatus());
            assertEquals(NotionApiException.FailureReason.NETWORK, e.getReason());
            assertTrue(e.getCause().getCause() instanceof IOException);
        }
    }
}
