package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.serializer.SerializerFeature;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * 访问 Notion 的命令基类
 * 子类只负责调用客户端，结果统一以格式化 JSON 输出到 stdout
 */
public abstract class AbstractClientCommand implements Callable<Integer> {

    static final int MAX_LIMIT = 100;

    protected final NotionClient client;

    @Spec
    protected CommandSpec spec;

    @Option(names = "--no-cache", description = "Bypass the local cache for this invocation")
    boolean noCache;

    protected AbstractClientCommand(NotionClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        if (noCache) {
            client.disableCache();
        }
        try {
            print(execute());
        } finally {
            if (noCache) {
                client.enableCache();
            }
        }
        return 0;
    }

    /**
     * 执行命令
     *
     * @return 要输出的结果
     */
    protected abstract Object execute();

    protected void print(Object result) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(JSON.toJSONString(result, SerializerFeature.PrettyFormat));
        out.flush();
    }

    protected JSONObject parseObject(String value) {
        if (value == null) {
            return null;
        }
        try {
            JSONObject json = JSON.parseObject(value);
            if (json == null) {
                throw invalidJson(value);
            }
            return json;
        } catch (JSONException | ClassCastException e) {
            throw invalidJson(value);
        }
    }

    protected JSONArray parseArray(String value) {
        if (value == null) {
            return null;
        }
        try {
            JSONArray json = JSON.parseArray(value);
            if (json == null) {
                throw invalidJson(value);
            }
            return json;
        } catch (JSONException | ClassCastException e) {
            throw invalidJson(value);
        }
    }

    protected Integer checkLimit(Integer limit) {
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new ParameterException(spec.commandLine(),
                    "--limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
        return limit;
    }

    private ParameterException invalidJson(String value) {
        return new ParameterException(spec.commandLine(), "Invalid JSON: " + value);
    }
}
