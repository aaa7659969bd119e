package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.model.SearchOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 搜索工作区
 */
@Command(name = "search", mixinStandardHelpOptions = true, description = "Search pages and databases")
public class SearchCommand extends AbstractClientCommand {

    @Option(names = "--query", description = "Search text", defaultValue = "")
    String query;

    @Option(names = "--filter", description = "Filter object as JSON, e.g. {\"property\":\"object\",\"value\":\"page\"}")
    String filter;

    @Option(names = "--cursor", description = "Start cursor from a previous response")
    String cursor;

    @Option(names = "--limit", description = "Page size (1-100)")
    Integer limit;

    public SearchCommand(NotionClient client) {
        super(client);
    }

    @Override
    protected Object execute() {
        SearchOptions options = SearchOptions.builder()
                .filter(parseObject(filter))
                .pageSize(checkLimit(limit))
                .startCursor(cursor)
                .build();
        return client.search(query, options);
    }
}
