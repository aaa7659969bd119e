package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.model.CommentQuery;
import cn.bafuka.notioncache.model.CommentRequest;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 评论相关命令
 */
public final class CommentCommands {

    private CommentCommands() {
    }

    @Command(name = "get-comments", mixinStandardHelpOptions = true, description = "List comments on a page or block")
    public static class GetComments extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page or block ID")
        String id;

        @Option(names = "--cursor", description = "Start cursor from a previous response")
        String cursor;

        @Option(names = "--limit", description = "Page size (1-100)")
        Integer limit;

        public GetComments(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.getComments(new CommentQuery(id, cursor, checkLimit(limit)));
        }
    }

    @Command(name = "create-comment", mixinStandardHelpOptions = true, description = "Comment on a page")
    public static class CreateComment extends AbstractClientCommand {

        @Option(names = "--id", required = true, description = "Page ID")
        String id;

        @Option(names = "--text", required = true, description = "Comment text")
        String text;

        public CreateComment(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            return client.createComment(CommentRequest.onPage(id, text));
        }
    }
}
