package cn.bafuka.notioncache.client;

import cn.bafuka.notioncache.model.TtlTier;

/**
 * 可缓存的读操作
 * tag 作为缓存键的操作名，tier 决定 TTL 档位
 */
public enum ReadOperation {

    SEARCH("search", TtlTier.LISTING),
    PAGE("page", TtlTier.RESOURCE),
    BLOCKS("blocks", TtlTier.RESOURCE),
    DATABASE("database", TtlTier.RESOURCE),
    DATABASE_QUERY("database_query", TtlTier.LISTING),
    BLOCK("block", TtlTier.RESOURCE),
    USERS("users", TtlTier.IDENTITY),
    USER("user", TtlTier.IDENTITY),
    SELF("self", TtlTier.IDENTITY),
    COMMENTS("comments", TtlTier.LISTING),
    DATABASES_LIST("databases_list", TtlTier.LISTING);

    private final String tag;

    private final TtlTier tier;

    ReadOperation(String tag, TtlTier tier) {
        this.tag = tag;
        this.tier = tier;
    }

    public String getTag() {
        return tag;
    }

    public TtlTier getTier() {
        return tier;
    }
}
