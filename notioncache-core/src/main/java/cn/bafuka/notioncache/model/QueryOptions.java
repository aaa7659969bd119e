package cn.bafuka.notioncache.model;

import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 数据库查询选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryOptions {

    /**
     * Notion 过滤条件
     */
    private JSONObject filter;

    /**
     * 排序条件数组
     */
    private JSONArray sorts;

    private Integer pageSize;

    private String startCursor;
}
