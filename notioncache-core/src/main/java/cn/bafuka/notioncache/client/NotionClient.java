package cn.bafuka.notioncache.client;

import cn.bafuka.notioncache.core.CacheKeys;
import cn.bafuka.notioncache.core.CacheStats;
import cn.bafuka.notioncache.core.CacheStore;
import cn.bafuka.notioncache.core.KeyPatterns;
import cn.bafuka.notioncache.dataplane.FetchCoordinator;
import cn.bafuka.notioncache.model.CommentQuery;
import cn.bafuka.notioncache.model.CommentRequest;
import cn.bafuka.notioncache.model.FetchOptions;
import cn.bafuka.notioncache.model.PageCursor;
import cn.bafuka.notioncache.model.PageParent;
import cn.bafuka.notioncache.model.QueryOptions;
import cn.bafuka.notioncache.model.SearchOptions;
import cn.bafuka.notioncache.model.TtlPolicy;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import static cn.bafuka.notioncache.client.ReadOperation.BLOCK;
import static cn.bafuka.notioncache.client.ReadOperation.BLOCKS;
import static cn.bafuka.notioncache.client.ReadOperation.COMMENTS;
import static cn.bafuka.notioncache.client.ReadOperation.DATABASE;
import static cn.bafuka.notioncache.client.ReadOperation.DATABASES_LIST;
import static cn.bafuka.notioncache.client.ReadOperation.DATABASE_QUERY;
import static cn.bafuka.notioncache.client.ReadOperation.PAGE;
import static cn.bafuka.notioncache.client.ReadOperation.SEARCH;
import static cn.bafuka.notioncache.client.ReadOperation.SELF;
import static cn.bafuka.notioncache.client.ReadOperation.USER;
import static cn.bafuka.notioncache.client.ReadOperation.USERS;

/**
 * Notion 工作区客户端
 * <p>
 * 读操作按「操作名 + 全部参数」构造缓存键并经由取数协调器读取；
 * 写操作先调用远程接口，成功后再失效可能变旧的读缓存，失败时不做任何失效
 */
@Slf4j
public class NotionClient {

    private final NotionApiTransport transport;

    private final FetchCoordinator<JSONObject> fetchCoordinator;

    private final CacheStore<JSONObject> cacheStore;

    private final TtlPolicy ttlPolicy;

    public NotionClient(NotionApiTransport transport, FetchCoordinator<JSONObject> fetchCoordinator,
                        TtlPolicy ttlPolicy) {
        this.transport = transport;
        this.fetchCoordinator = fetchCoordinator;
        this.cacheStore = fetchCoordinator.getCacheStore();
        this.ttlPolicy = ttlPolicy;
    }

    // ============================================
    // 缓存控制
    // ============================================

    public void disableCache() {
        fetchCoordinator.disable();
    }

    public void enableCache() {
        fetchCoordinator.enable();
    }

    public CacheStats getCacheStats() {
        return cacheStore.getStats();
    }

    /**
     * 清空缓存
     *
     * @return 清除的条目数
     */
    public int clearCache() {
        return cacheStore.clear();
    }

    public boolean invalidateCacheKey(String key) {
        return cacheStore.invalidate(key);
    }

    // ============================================
    // 搜索
    // ============================================

    /**
     * 搜索工作区
     *
     * @param query   搜索文本，null 视为空串
     * @param options 过滤与分页选项，可为 null
     * @return 搜索结果
     */
    public JSONObject search(String query, SearchOptions options) {
        String text = query == null ? "" : query;
        SearchOptions opts = options == null ? new SearchOptions() : options;

        String key = CacheKeys.builder(SEARCH.getTag())
                .param("query", text)
                .param("filter", opts.getFilter())
                .param("pageSize", opts.getPageSize())
                .param("startCursor", opts.getStartCursor())
                .build();

        return read(SEARCH, key, () -> {
            JSONObject body = new JSONObject(true);
            body.put("query", text);
            putIfPresent(body, "filter", opts.getFilter());
            putIfPresent(body, "page_size", opts.getPageSize());
            putIfPresent(body, "start_cursor", opts.getStartCursor());
            return transport.post("/search", body);
        });
    }

    // ============================================
    // 页面
    // ============================================

    public JSONObject getPage(String pageId) {
        String key = CacheKeys.builder(PAGE.getTag()).param("id", pageId).build();
        return read(PAGE, key, () -> transport.get("/pages/" + pageId));
    }

    /**
     * 获取页面或块的子块
     *
     * @param blockId 页面或块 ID
     * @param cursor  分页参数，可为 null
     * @return 子块列表
     */
    public JSONObject getBlocks(String blockId, PageCursor cursor) {
        PageCursor page = cursor == null ? new PageCursor() : cursor;
        String key = CacheKeys.builder(BLOCKS.getTag())
                .param("id", blockId)
                .param("startCursor", page.getStartCursor())
                .param("pageSize", page.getPageSize())
                .build();

        return read(BLOCKS, key, () -> transport.get("/blocks/" + blockId + "/children", cursorParams(page)));
    }

    /**
     * 创建页面
     * 失效：全部 search；父级为数据库时失效该数据库的 database_query
     *
     * @param parent     父级位置
     * @param properties 页面属性
     * @param children   初始内容块，可为 null
     * @return 创建的页面
     */
    public JSONObject createPage(PageParent parent, JSONObject properties, JSONArray children) {
        JSONObject body = new JSONObject(true);
        body.put("parent", parent.toJson());
        body.put("properties", properties == null ? new JSONObject() : properties);
        putIfPresent(body, "children", children);

        JSONObject result = transport.post("/pages", body);

        invalidateOperation(SEARCH);
        if (parent.getDatabaseId() != null) {
            invalidateParameter(DATABASE_QUERY, "id", parent.getDatabaseId());
        }
        return result;
    }

    /**
     * 更新页面属性
     * 失效：该页面、全部 search、全部 database_query
     *
     * @param pageId     页面 ID
     * @param properties 要更新的属性
     * @param archived   是否归档，null 表示不修改
     * @return 更新后的页面
     */
    public JSONObject updatePage(String pageId, JSONObject properties, Boolean archived) {
        JSONObject body = new JSONObject(true);
        body.put("properties", properties == null ? new JSONObject() : properties);
        putIfPresent(body, "archived", archived);

        JSONObject result = transport.patch("/pages/" + pageId, body);
        invalidatePageReads(pageId);
        return result;
    }

    /**
     * 归档（软删除）页面，失效范围同 updatePage
     */
    public JSONObject archivePage(String pageId) {
        JSONObject body = new JSONObject(true);
        body.put("archived", true);

        JSONObject result = transport.patch("/pages/" + pageId, body);
        invalidatePageReads(pageId);
        return result;
    }

    // ============================================
    // 数据库
    // ============================================

    public JSONObject getDatabase(String databaseId) {
        String key = CacheKeys.builder(DATABASE.getTag()).param("id", databaseId).build();
        return read(DATABASE, key, () -> transport.get("/databases/" + databaseId));
    }

    /**
     * 查询数据库
     *
     * @param databaseId 数据库 ID
     * @param options    过滤、排序与分页，可为 null
     * @return 查询结果
     */
    public JSONObject queryDatabase(String databaseId, QueryOptions options) {
        QueryOptions opts = options == null ? new QueryOptions() : options;
        String key = CacheKeys.builder(DATABASE_QUERY.getTag())
                .param("id", databaseId)
                .param("filter", opts.getFilter())
                .param("sorts", opts.getSorts())
                .param("pageSize", opts.getPageSize())
                .param("startCursor", opts.getStartCursor())
                .build();

        return read(DATABASE_QUERY, key, () -> {
            JSONObject body = new JSONObject(true);
            putIfPresent(body, "filter", opts.getFilter());
            putIfPresent(body, "sorts", opts.getSorts());
            putIfPresent(body, "page_size", opts.getPageSize());
            putIfPresent(body, "start_cursor", opts.getStartCursor());
            return transport.post("/databases/" + databaseId + "/query", body);
        });
    }

    /**
     * 在数据库中新建一行（createPage 的便捷封装）
     */
    public JSONObject createDatabaseRow(String databaseId, JSONObject properties) {
        return createPage(PageParent.database(databaseId), properties, null);
    }

    /**
     * 列出可访问的全部数据库（search 的便捷封装，结果单独缓存）
     */
    public JSONObject listDatabases() {
        String key = CacheKeys.of(DATABASES_LIST.getTag());
        return read(DATABASES_LIST, key, () -> {
            JSONObject filter = new JSONObject(true);
            filter.put("property", "object");
            filter.put("value", "database");
            return search("", SearchOptions.builder().filter(filter).build());
        });
    }

    // ============================================
    // 块
    // ============================================

    public JSONObject getBlock(String blockId) {
        String key = CacheKeys.builder(BLOCK.getTag()).param("id", blockId).build();
        return read(BLOCK, key, () -> transport.get("/blocks/" + blockId));
    }

    /**
     * 追加子块
     * 失效：该块的全部子块列表（所有分页）
     */
    public JSONObject appendBlocks(String blockId, JSONArray children) {
        JSONObject body = new JSONObject(true);
        body.put("children", children == null ? new JSONArray() : children);

        JSONObject result = transport.patch("/blocks/" + blockId + "/children", body);
        invalidateParameter(BLOCKS, "id", blockId);
        return result;
    }

    /**
     * 删除块
     * 失效：该块本身、它的子块列表，以及响应中父级的子块列表
     */
    public JSONObject deleteBlock(String blockId) {
        JSONObject result = transport.delete("/blocks/" + blockId);

        cacheStore.invalidate(CacheKeys.builder(BLOCK.getTag()).param("id", blockId).build());
        invalidateParameter(BLOCKS, "id", blockId);

        String parentId = parentIdOf(result);
        if (parentId != null) {
            invalidateParameter(BLOCKS, "id", parentId);
        }
        return result;
    }

    // ============================================
    // 用户
    // ============================================

    public JSONObject listUsers(PageCursor cursor) {
        PageCursor page = cursor == null ? new PageCursor() : cursor;
        String key = CacheKeys.builder(USERS.getTag())
                .param("startCursor", page.getStartCursor())
                .param("pageSize", page.getPageSize())
                .build();

        return read(USERS, key, () -> transport.get("/users", cursorParams(page)));
    }

    public JSONObject getUser(String userId) {
        String key = CacheKeys.builder(USER.getTag()).param("id", userId).build();
        return read(USER, key, () -> transport.get("/users/" + userId));
    }

    /**
     * 获取集成对应的机器人用户
     */
    public JSONObject getSelf() {
        return read(SELF, CacheKeys.of(SELF.getTag()), () -> transport.get("/users/me"));
    }

    // ============================================
    // 评论
    // ============================================

    public JSONObject getComments(CommentQuery query) {
        CommentQuery q = query == null ? new CommentQuery() : query;
        String key = CacheKeys.builder(COMMENTS.getTag())
                .param("blockId", q.getBlockId())
                .param("startCursor", q.getStartCursor())
                .param("pageSize", q.getPageSize())
                .build();

        return read(COMMENTS, key, () -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("block_id", q.getBlockId());
            params.put("start_cursor", q.getStartCursor());
            params.put("page_size", q.getPageSize());
            return transport.get("/comments", params);
        });
    }

    /**
     * 创建评论
     * 失效：父页面的全部评论列表
     */
    public JSONObject createComment(CommentRequest request) {
        JSONObject result = transport.post("/comments", request.toJson());
        if (request.getParentPageId() != null) {
            invalidateParameter(COMMENTS, "blockId", request.getParentPageId());
        }
        return result;
    }

    // ============================================
    // 内部方法
    // ============================================

    private JSONObject read(ReadOperation operation, String key, Supplier<JSONObject> producer) {
        FetchOptions options = FetchOptions.ttl(ttlPolicy.ttlFor(operation.getTier()));
        return fetchCoordinator.getOrFetch(key, producer, options);
    }

    private void invalidatePageReads(String pageId) {
        cacheStore.invalidate(CacheKeys.builder(PAGE.getTag()).param("id", pageId).build());
        invalidateOperation(SEARCH);
        invalidateOperation(DATABASE_QUERY);
    }

    private void invalidateOperation(ReadOperation operation) {
        int removed = cacheStore.invalidatePattern(KeyPatterns.operation(cacheStore.getNamespace(), operation.getTag()));
        log.debug("写操作触发失效: operation={}, removed={}", operation.getTag(), removed);
    }

    private void invalidateParameter(ReadOperation operation, String name, String value) {
        int removed = cacheStore.invalidatePattern(
                KeyPatterns.parameter(cacheStore.getNamespace(), operation.getTag(), name, value));
        log.debug("写操作触发失效: operation={}, {}={}, removed={}", operation.getTag(), name, value, removed);
    }

    private static Map<String, Object> cursorParams(PageCursor cursor) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("start_cursor", cursor.getStartCursor());
        params.put("page_size", cursor.getPageSize());
        return params;
    }

    private static void putIfPresent(JSONObject body, String name, Object value) {
        if (value != null) {
            body.put(name, value);
        }
    }

    private static String parentIdOf(JSONObject block) {
        if (block == null) {
            return null;
        }
        JSONObject parent = block.getJSONObject("parent");
        if (parent == null) {
            return null;
        }
        String blockId = parent.getString("block_id");
        return blockId != null ? blockId : parent.getString("page_id");
    }
}
