package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.model.QueryOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 数据库相关命令
 */
public final class DatabaseCommands {

    private DatabaseCommands() {
    }

    @Command(name = "get-database", mixinStandardHelpOptions = true, description = "Get a database by ID")
    public static class GetDatabase extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Database ID")
        String id;

        public GetDatabase(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getDatabase(id);
        }
    }

    @Command(name = "query-database", mixinStandardHelpOptions = true, description = "Query the rows of a database")
    public static class QueryDatabase extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Database ID")
        String id;

        @Option(names = "--filter", description = "Filter as JSON")
        String filter;

        @Option(names = "--sorts", description = "Sorts as a JSON array")
        String sorts;

        @Option(names = "--cursor", description = "Start cursor from a previous response")
        String cursor;

        @Option(names = "--limit", description = "Page size (1-100)")
        Integer limit;

        public QueryDatabase(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            QueryOptions options = QueryOptions.builder()
                    .filter(parseObject(filter))
                    .sorts(parseArray(sorts))
                    .pageSize(checkLimit(limit))
                    .startCursor(cursor)
                    .build();
            return client.queryDatabase(id, options);
        }
    }

    @Command(name = "create-database-row", mixinStandardHelpOptions = true, description = "Add a row to a database")
    public static class CreateDatabaseRow extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Database ID")
        String id;

        @Option(names = "--properties", required = true, description = "Row properties as JSON")
        String properties;

        public CreateDatabaseRow(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.createDatabaseRow(id, parseObject(properties));
        }
    }

    @Command(name = "list-databases", mixinStandardHelpOptions = true, description = "List accessible databases")
    public static class ListDatabases extends AbstractClientCommand {

        public ListDatabases(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.listDatabases();
        }
    }
}
