package cn.bafuka.notioncache.cli.command;

import cn.bafuka.notioncache.client.NotionClient;
import cn.bafuka.notioncache.core.CacheStats;
import com.alibaba.fastjson.JSONObject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * 本地缓存管理命令
 */
public final class CacheCommands {

    private CacheCommands() {
    }

    @Command(name = "cache-stats", mixinStandardHelpOptions = true, description = "Show cache counters")
    public static class Stats extends AbstractClientCommand {

        public Stats(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            CacheStats stats = client.getCacheStats();
            JSONObject result = new JSONObject(true);
            result.put("namespace", stats.getNamespace());
            result.put("enabled", stats.isEnabled());
            result.put("size", stats.getSize());
            result.put("hits", stats.getHits());
            result.put("misses", stats.getMisses());
            result.put("writes", stats.getWrites());
            result.put("invalidations", stats.getInvalidations());
            result.put("expirations", stats.getExpirations());
            result.put("hitRate", stats.hitRate());
            return result;
        }
    }

    @Command(name = "cache-clear", mixinStandardHelpOptions = true, description = "Remove every cached entry")
    public static class Clear extends AbstractClientCommand {

        public Clear(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            JSONObject result = new JSONObject(true);
            result.put("cleared", client.clearCache());
            return result;
        }
    }

    @Command(name = "cache-invalidate", mixinStandardHelpOptions = true, description = "Remove one cached entry")
    public static class Invalidate extends AbstractClientCommand {

        @Option(names = "--key", required = true, description = "Cache key, e.g. page:id=<id>")
        String key;

        public Invalidate(NotionClient client) {
            super(client);
        }

        @Override
        protected Object execute() {
            JSONObject result = new JSONObject(true);
            result.put("key", key);
            result.put("invalidated", client.invalidateCacheKey(key));
            return result;
        }
    }
}
