package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.model.PageCursor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 用户相关命令
 */
public final class UserCommands {

    private UserCommands() {
    }

    @Command(name = "list-users", mixinStandardHelpOptions = true, description = "List workspace users")
    public static class ListUsers extends AbstractClientCommand {

        @Option(names = "--cursor", description = "Start cursor from a previous response")
        String cursor;

        @Option(names = "--limit", description = "Page size (1-100)")
        Integer limit;

        public ListUsers(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.listUsers(new PageCursor(cursor, checkLimit(limit)));
        }
    }

    @Command(name = "get-user", mixinStandardHelpOptions = true, description = "Get a user by ID")
    public static class GetUser extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "User ID")
        String id;

        public GetUser(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getUser(id);
        }
    }

    @Command(name = "get-self", mixinStandardHelpOptions = true, description = "Get the integration's bot user")
    public static class GetSelf extends AbstractClientCommand {

        public GetSelf(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getSelf();
        }
    }
}
