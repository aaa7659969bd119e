package cn.bafuka.notioncache.model;

import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 新页面的父级位置，databaseId 与 pageId 二选一
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageParent {

    private String databaseId;

    private String pageId;

    public static PageParent database(String databaseId) {
        return PageParent.builder().databaseId(databaseId).build();
    }

    public static PageParent page(String pageId) {
        return PageParent.builder().pageId(pageId).build();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject(true);
        if (databaseId != null) {
            json.put("database_id", databaseId);
        }
        if (pageId != null) {
            json.put("page_id", pageId);
        }
        return json;
    }
}
