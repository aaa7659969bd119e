package cn.bafuka.notioncache.cli.command;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * 根命令，未指定子命令时打印帮助
 */
@Command(
        name = "notion-cli",
        mixinStandardHelpOptions = true,
        version = "notion-cli 1.0.0",
        description = "Notion workspace client with a local request cache",
        subcommands = {
                SearchCommand.class,
                PageCommands.GetPage.class,
                PageCommands.GetPageContent.class,
                PageCommands.CreatePage.class,
                PageCommands.UpdatePage.class,
                PageCommands.ArchivePage.class,
                DatabaseCommands.GetDatabase.class,
                DatabaseCommands.QueryDatabase.class,
                DatabaseCommands.CreateDatabaseRow.class,
                DatabaseCommands.ListDatabases.class,
                BlockCommands.GetBlock.class,
                BlockCommands.AppendBlocks.class,
                BlockCommands.DeleteBlock.class,
                UserCommands.ListUsers.class,
                UserCommands.GetUser.class,
                UserCommands.GetSelf.class,
                CommentCommands.GetComments.class,
                CommentCommands.CreateComment.class,
                CacheCommands.Stats.class,
                CacheCommands.Clear.class,
                CacheCommands.Invalidate.class
        }
)
public class NotionCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
