package cn.bafuka.notioncache.core;

import java.util.regex.Pattern;

/**
 * 失效模式构造工具
 * 生成的正则作用于完整键（命名空间 + ":" + 缓存键）
 */
public final class KeyPatterns {

    private KeyPatterns() {
    }

    /**
     * 匹配某个操作的全部缓存键
     *
     * @param namespace 命名空间
     * @param operation 操作名
     * @return 正则
     */
    public static Pattern operation(String namespace, String operation) {
        return Pattern.compile("^" + Pattern.quote(namespace + ":" + operation) + "(:|$)");
    }

    /**
     * 匹配某个操作中参数 name 恰好等于 value 的全部缓存键，不管其余参数（游标、分页、过滤）是什么
     *
     * @param namespace 命名空间
     * @param operation 操作名
     * @param name      参数名
     * @param value     参数值
     * @return 正则
     */
    public static Pattern parameter(String namespace, String operation, String name, Object value) {
        return Pattern.compile("^" + Pattern.quote(namespace + ":" + operation + CacheKeys.OPERATION_SEPARATOR)
                + "(.*&)?"
                + Pattern.quote(name + "=" + CacheKeys.encodeValue(value))
                + "(&|$)");
    }
}
