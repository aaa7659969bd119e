package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.core.CacheStats;
import cn.bafuka.notioncache.exception.NotionApiException;
import cn.bafuka.notioncache.model.CommentRequest;
import cn.bafuka.notioncache.model.PageCursor;
import cn.bafuka.notioncache.model.PageParent;
import cn.bafuka.notioncache.model.QueryOptions;
import cn.bafuka.notioncache.model.SearchOptions;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * 命令行参数处理测试
 */
public class NotionCommandLineTest {

    @Mock
    private NotionClient client;

    private StringWriter out;

    private StringWriter err;

    private CommandLine commandLine;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        out = new StringWriter();
        err = new StringWriter();
        commandLine = NotionCommandLine.create(client);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    public void testGetPagePrintsJson() {
        when(client.getPage("p1")).thenReturn(JSON.parseObject("{\"id\":\"p1\",\"object\":\"page\"}"));

        int exitCode = commandLine.execute("get-page", "--id", "p1");

        assertEquals(0, exitCode);
        assertEquals("p1", JSON.parseObject(out.toString()).getString("id"));
    }

    @Test
    public void testSearchOptions() {
        when(client.search(anyString(), any(SearchOptions.class))).thenReturn(new JSONObject());

        int exitCode = commandLine.execute("search", "--query", "roadmap",
                "--filter", "{\"property\":\"object\",\"value\":\"page\"}", "--limit", "20", "--cursor", "c1");

        assertEquals(0, exitCode);
        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(client).search(eq("roadmap"), options.capture());
        assertEquals(Integer.valueOf(20), options.getValue().getPageSize());
        assertEquals("c1", options.getValue().getStartCursor());
        assertEquals("page", options.getValue().getFilter().getString("value"));
    }

    /**
     * 测试 --limit 超出范围为参数错误
     */
    @Test
    public void testLimitOutOfRange() {
        assertEquals(2, commandLine.execute("search", "--limit", "101"));
        assertEquals(2, commandLine.execute("list-users", "--limit", "0"));
        verifyNoInteractions(client);
    }

    /**
     * 测试非法 JSON 为参数错误
     */
    @Test
    public void testInvalidJson() {
        int exitCode = commandLine.execute("update-page", "--id", "p1", "--properties", "{oops");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Invalid JSON: {oops"));
        verify(client, never()).updatePage(anyString(), any(), any());
    }

    @Test
    public void testMissingRequiredOption() {
        assertEquals(2, commandLine.execute("get-page"));
    }

    @Test
    public void testCreatePageRequiresParent() {
        int exitCode = commandLine.execute("create-page", "--title", "Plan");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Either --parent-page or --parent-database is required"));
    }

    /**
     * 测试 --title 填充 title 属性
     */
    @Test
    public void testCreatePageWithTitle() {
        when(client.createPage(any(PageParent.class), any(JSONObject.class), isNull())).thenReturn(new JSONObject());

        int exitCode = commandLine.execute("create-page", "--parent-database", "D", "--title", "Plan",
                "--properties", "{\"Status\":{\"select\":{\"name\":\"Todo\"}}}");

        assertEquals(0, exitCode);
        ArgumentCaptor<PageParent> parent = ArgumentCaptor.forClass(PageParent.class);
        ArgumentCaptor<JSONObject> properties = ArgumentCaptor.forClass(JSONObject.class);
        verify(client).createPage(parent.capture(), properties.capture(), isNull());
        assertEquals("D", parent.getValue().getDatabaseId());
        assertTrue(properties.getValue().containsKey("Status"));
        assertEquals("Plan", properties.getValue().getJSONObject("title").getJSONArray("title")
                .getJSONObject(0).getJSONObject("text").getString("content"));
    }

    @Test
    public void testQueryDatabase() {
        when(client.queryDatabase(eq("D"), any(QueryOptions.class))).thenReturn(new JSONObject());

        int exitCode = commandLine.execute("query-database", "--id", "D",
                "--sorts", "[{\"property\":\"Name\",\"direction\":\"ascending\"}]");

        assertEquals(0, exitCode);
        ArgumentCaptor<QueryOptions> options = ArgumentCaptor.forClass(QueryOptions.class);
        verify(client).queryDatabase(eq("D"), options.capture());
        assertEquals(1, options.getValue().getSorts().size());
        assertNull(options.getValue().getFilter());
    }

    @Test
    public void testAppendBlocksRequiresArray() {
        assertEquals(2, commandLine.execute("append-blocks", "--id", "b1", "--children", "{\"type\":\"paragraph\"}"));

        when(client.appendBlocks(eq("b1"), any(JSONArray.class))).thenReturn(new JSONObject());
        assertEquals(0, commandLine.execute("append-blocks", "--id", "b1", "--children", "[]"));
    }

    @Test
    public void testGetPageContentUsesCursor() {
        when(client.getBlocks(eq("p1"), any(PageCursor.class))).thenReturn(new JSONObject());

        assertEquals(0, commandLine.execute("get-page-content", "--id", "p1", "--cursor", "c9", "--limit", "50"));

        verify(client).getBlocks("p1", new PageCursor("c9", 50));
    }

    @Test
    public void testCreateComment() {
        when(client.createComment(any(CommentRequest.class))).thenReturn(new JSONObject());

        assertEquals(0, commandLine.execute("create-comment", "--id", "p1", "--text", "LGTM"));

        ArgumentCaptor<CommentRequest> request = ArgumentCaptor.forClass(CommentRequest.class);
        verify(client).createComment(request.capture());
        assertEquals("p1", request.getValue().getParentPageId());
    }

    /**
     * 测试 --no-cache 在命令执行期间禁用缓存，结束后恢复
     */
    @Test
    public void testNoCache() {
        when(client.getSelf()).thenReturn(new JSONObject());

        assertEquals(0, commandLine.execute("get-self", "--no-cache"));

        InOrder inOrder = inOrder(client);
        inOrder.verify(client).disableCache();
        inOrder.verify(client).getSelf();
        inOrder.verify(client).enableCache();
    }

    /**
     * 测试远程错误退出码为 1
     */
    @Test
    public void testApiError() {
        when(client.getPage("missing")).thenThrow(NotionApiException.fromResponse(404, "{}"));

        int exitCode = commandLine.execute("get-page", "--id", "missing");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Notion API error (404)"));
        assertEquals("", out.toString());
    }

    @Test
    public void testCacheStats() {
        when(client.getCacheStats()).thenReturn(CacheStats.builder()
                .namespace("notion-workspace-manager").enabled(true).hits(3).misses(1).size(2).build());

        assertEquals(0, commandLine.execute("cache-stats"));

        JSONObject stats = JSON.parseObject(out.toString());
        assertEquals(3, stats.getIntValue("hits"));
        assertEquals(0.75, stats.getDoubleValue("hitRate"), 0.0001);
    }

    @Test
    public void testCacheInvalidate() {
        when(client.invalidateCacheKey("page:id=p1")).thenReturn(true);

        assertEquals(0, commandLine.execute("cache-invalidate", "--key", "page:id=p1"));

        assertTrue(JSON.parseObject(out.toString()).getBooleanValue("invalidated"));
    }

    @Test
    public void testNoSubcommandPrintsUsage() {
        assertEquals(0, commandLine.execute());
        assertTrue(out.toString().contains("notion-cli"));
    }

    /**
     * 测试命令工厂通过公开构造器注入客户端
     */
    @Test
    public void testFactoryInjectsClient() throws Exception {
        NotionCommandLine.ClientFactory factory = new NotionCommandLine.ClientFactory(client);

        PageCommands.GetPage command = factory.create(PageCommands.GetPage.class);

        assertSame(client, command.client);
        assertNotNull(factory.create(NotionCommand.class));
    }
}
