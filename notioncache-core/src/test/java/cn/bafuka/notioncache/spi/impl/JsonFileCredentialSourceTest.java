package cn.bafuka.notioncache.spi.impl;

import cn.bafuka.notioncache.config.NotionCacheProperties;
import cn.bafuka.notioncache.spi.CredentialSource;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * 凭据来源单元测试
 */
public class JsonFileCredentialSourceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testNotionFormat() throws IOException {
        File config = write("{\"notion\":{\"apiToken\":\"secret_new\"}}");

        assertEquals("secret_new", new JsonFileCredentialSource(config.toPath()).getApiToken());
    }

    /**
     * 测试旧版 MCP 格式
     */
    @Test
    public void testLegacyMcpFormat() throws IOException {
        File config = write("{\"mcpServer\":{\"env\":{\"NOTION_API_TOKEN\":\"secret_legacy\"}}}");

        assertEquals("secret_legacy", new JsonFileCredentialSource(config.toPath()).getApiToken());
    }

    @Test
    public void testNewFormatPreferred() throws IOException {
        File config = write("{\"notion\":{\"apiToken\":\"secret_new\"},"
                + "\"mcpServer\":{\"env\":{\"NOTION_API_TOKEN\":\"secret_legacy\"}}}");

        assertEquals("secret_new", new JsonFileCredentialSource(config.toPath()).getApiToken());
    }

    @Test
    public void testMissingFile() {
        File missing = new File(folder.getRoot(), "config.json");

        assertNull(new JsonFileCredentialSource(missing.toPath()).getApiToken());
    }

    @Test
    public void testMissingToken() throws IOException {
        File config = write("{\"notion\":{\"apiToken\":\"\"}}");

        assertNull(new JsonFileCredentialSource(config.toPath()).getApiToken());
    }

    @Test(expected = IllegalStateException.class)
    public void testInvalidJson() throws IOException {
        File config = write("{not json");

        new JsonFileCredentialSource(config.toPath()).getApiToken();
    }

    /**
     * 测试配置属性优先于配置文件
     */
    @Test
    public void testChainPrefersProperties() throws IOException {
        File config = write("{\"notion\":{\"apiToken\":\"from_file\"}}");
        NotionCacheProperties properties = new NotionCacheProperties();
        properties.getApi().setToken("from_properties");

        ChainedCredentialSource chain = new ChainedCredentialSource(Arrays.<CredentialSource>asList(
                new PropertiesCredentialSource(properties),
                new JsonFileCredentialSource(config.toPath())));

        assertEquals("from_properties", chain.requireApiToken());
    }

    @Test
    public void testChainFallsBackToFile() throws IOException {
        File config = write("{\"notion\":{\"apiToken\":\"from_file\"}}");

        ChainedCredentialSource chain = new ChainedCredentialSource(Arrays.<CredentialSource>asList(
                new PropertiesCredentialSource(new NotionCacheProperties()),
                new JsonFileCredentialSource(config.toPath())));

        assertEquals("from_file", chain.requireApiToken());
    }

    @Test
    public void testChainMissingToken() {
        ChainedCredentialSource chain = new ChainedCredentialSource(Arrays.<CredentialSource>asList(
                new PropertiesCredentialSource(new NotionCacheProperties()),
                new JsonFileCredentialSource(new File(folder.getRoot(), "absent.json").toPath())));

        try {
            chain.requireApiToken();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals(ChainedCredentialSource.MISSING_TOKEN_MESSAGE, e.getMessage());
        }
    }

    /**
     * 测试解析到的 Token 被复用，配置文件只读取一次
     */
    @Test
    public void testChainResolvesTokenOnce() {
        CredentialSource file = mock(CredentialSource.class);
        when(file.getApiToken()).thenReturn("from_file");
        when(file.getType()).thenReturn("json-file");

        ChainedCredentialSource chain = new ChainedCredentialSource(Arrays.<CredentialSource>asList(
                new PropertiesCredentialSource(new NotionCacheProperties()), file));

        assertEquals("from_file", chain.requireApiToken());
        assertEquals("from_file", chain.requireApiToken());
        assertEquals("from_file", chain.getApiToken());
        verify(file, times(1)).getApiToken();
    }

    /**
     * 测试未找到 Token 时不缓存结果，之后出现的凭据仍可被读取
     */
    @Test
    public void testChainRetriesUntilTokenFound() {
        CredentialSource file = mock(CredentialSource.class);
        when(file.getApiToken()).thenReturn(null, "late_token");

        ChainedCredentialSource chain = new ChainedCredentialSource(Arrays.<CredentialSource>asList(file));

        assertNull(chain.getApiToken());
        assertEquals("late_token", chain.requireApiToken());
    }

    private File write(String content) throws IOException {
        File file = folder.newFile("config.json");
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
