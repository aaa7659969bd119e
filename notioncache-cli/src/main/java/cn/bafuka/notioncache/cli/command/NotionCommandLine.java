package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.exception.NotionApiException;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.lang.reflect.Constructor;

/**
 * 组装 picocli 命令行
 * <p>
 * 退出码：0 成功，1 远程接口或运行时错误，2 参数错误
 */
@Slf4j
public final class NotionCommandLine {

    private NotionCommandLine() {
    }

    public static CommandLine create(NotionClient client) {
        CommandLine commandLine = new CommandLine(new NotionCommand(), new ClientFactory(client));
        commandLine.setExecutionExceptionHandler(NotionCommandLine::handleExecutionException);
        return commandLine;
    }

    private static int handleExecutionException(Exception e, CommandLine commandLine,
                                                CommandLine.ParseResult parseResult) {
        if (e instanceof NotionApiException) {
            NotionApiException apiError = (NotionApiException) e;
            log.debug("命令执行失败: status={}, reason={}", apiError.getStatus(), apiError.getReason(), e);
        } else {
            log.debug("命令执行失败", e);
        }
        commandLine.getErr().println("Error: " + e.getMessage());
        commandLine.getErr().flush();
        return CommandLine.ExitCode.SOFTWARE;
    }

    /**
     * 为带 NotionClient 构造参数的命令注入客户端，其余交给 picocli 默认工厂
     */
    static class ClientFactory implements CommandLine.IFactory {

        private final NotionClient client;

        private final CommandLine.IFactory fallback = CommandLine.defaultFactory();

        ClientFactory(NotionClient client) {
            this.client = client;
        }

        @Override
        public <K> K create(Class<K> cls) throws Exception {
            Constructor<K> constructor;
            try {
                constructor = cls.getDeclaredConstructor(NotionClient.class);
            } catch (NoSuchMethodException e) {
                return fallback.create(cls);
            }
            return constructor.newInstance(client);
        }
    }
}
