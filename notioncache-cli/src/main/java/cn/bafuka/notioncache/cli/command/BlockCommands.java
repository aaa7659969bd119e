package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 块相关命令
 */
public final class BlockCommands {

    private BlockCommands() {
    }

    @Command(name = "get-block", mixinStandardHelpOptions = true, description = "Get a block by ID")
    public static class GetBlock extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Block ID")
        String id;

        public GetBlock(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getBlock(id);
        }
    }

    @Command(name = "append-blocks", mixinStandardHelpOptions = true, description = "Append child blocks")
    public static class AppendBlocks extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page or block ID")
        String id;

        @Option(names = "--children", required = true, description = "Blocks as a JSON array")
        String children;

        public AppendBlocks(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.appendBlocks(id, parseArray(children));
        }
    }

    @Command(name = "delete-block", mixinStandardHelpOptions = true, description = "Delete a block")
    public static class DeleteBlock extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Block ID")
        String id;

        public DeleteBlock(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.deleteBlock(id);
        }
    }
}
