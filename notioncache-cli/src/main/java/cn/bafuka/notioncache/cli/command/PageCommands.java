package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.model.PageCursor;
import cn.bafuka.notioncache.model.PageParent;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * 页面相关命令
 */
public final class PageCommands {

    private PageCommands() {
    }

    @Command(name = "get-page", mixinStandardHelpOptions = true, description = "Get a page by ID")
    public static class GetPage extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page ID")
        String id;

        public GetPage(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getPage(id);
        }
    }

    @Command(name = "get-page-content", mixinStandardHelpOptions = true, description = "List the blocks of a page")
    public static class GetPageContent extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page ID")
        String id;

        @Option(names = "--cursor", description = "Start cursor from a previous response")
        String cursor;

        @Option(names = "--limit", description = "Page size (1-100)")
        Integer limit;

        public GetPageContent(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getBlocks(id, new PageCursor(cursor, checkLimit(limit)));
        }
    }

    @Command(name = "create-page", mixinStandardHelpOptions = true, description = "Create a page")
    public static class CreatePage extends AbstractClientCommand {

        @Option(names = "--parent-page", description = "Parent page ID")
        String parentPage;

        @Option(names = "--parent-database", description = "Parent database ID")
        String parentDatabase;

        @Option(names = "--title", description = "Page title")
        String title;

        @Option(names = "--properties", description = "Page properties as JSON")
        String properties;

        @Option(names = "--children", description = "Initial blocks as a JSON array")
        String children;

        public CreatePage(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            PageParent parent;
            if (parentDatabase != null) {
                parent = PageParent.database(parentDatabase);
            } else if (parentPage != null) {
                parent = PageParent.page(parentPage);
            } else {
                throw new ParameterException(spec.commandLine(),
                        "Either --parent-page or --parent-database is required");
            }

            JSONObject props = parseObject(properties);
            if (props == null) {
                props = new JSONObject(true);
            }
            if (title != null && !props.containsKey("title")) {
                props.put("title", titleProperty(title));
            }
            JSONArray blocks = parseArray(children);

            return client.createPage(parent, props, blocks);
        }

        static JSONObject titleProperty(String title) {
            JSONObject content = new JSONObject(true);
            content.put("content", title);
            JSONObject text = new JSONObject(true);
            text.put("text", content);
            JSONArray items = new JSONArray();
            items.add(text);
            JSONObject property = new JSONObject(true);
            property.put("title", items);
            return property;
        }
    }

    @Command(name = "update-page", mixinStandardHelpOptions = true, description = "Update page properties")
    public static class UpdatePage extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page ID")
        String id;

        @Option(names = "--properties", required = true, description = "Properties to update as JSON")
        String properties;

        public UpdatePage(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.updatePage(id, parseObject(properties), null);
        }
    }

    @Command(name = "archive-page", mixinStandardHelpOptions = true, description = "Archive (soft delete) a page")
    public static class ArchivePage extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page ID")
        String id;

        public ArchivePage(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.archivePage(id);
        }
    }
}
