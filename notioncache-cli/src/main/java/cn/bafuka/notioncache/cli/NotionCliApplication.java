package cn.bafuka.notioncache.cli;

import cn.bafuka.notioncache.cli.command.NotionCommandLine;
import cn.bafuka.notioncache.client.NotionClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * notion-cli 启动类
 * 非 Web 应用，执行一条命令后以命令的退出码结束进程
 */
@SpringBootApplication
public class NotionCliApplication implements CommandLineRunner, ExitCodeGenerator {

    @Autowired
    private NotionClient notionClient;

    private int exitCode;

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(NotionCliApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = NotionCommandLine.create(notionClient).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
