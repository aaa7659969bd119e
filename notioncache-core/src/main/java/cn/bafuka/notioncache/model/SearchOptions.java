package cn.bafuka.notioncache.model;

import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 搜索选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchOptions {

    /**
     * 对象类型过滤，如 {"property":"object","value":"database"}
     */
    private JSONObject filter;

    /**
     * 每页数量（最大 100）
     */
    private Integer pageSize;

    /**
     * 分页游标
     */
    private String startCursor;
}
