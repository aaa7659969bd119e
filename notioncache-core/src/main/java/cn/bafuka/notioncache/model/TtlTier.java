package cn.bafuka.notioncache.model;

/**
 * TTL 档位
 */
public enum TtlTier {
    /**
     * 易变数据：列表、查询、搜索、评论
     */
    LISTING,

    /**
     * 单个资源读取：页面、块、数据库
     */
    RESOURCE,

    /**
     * 用户与身份数据
     */
    IDENTITY
}
