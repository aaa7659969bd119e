package cn.bafuka.notioncache.model;

import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建评论请求，parentPageId 与 discussionId 二选一
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentRequest {

    private String parentPageId;

    private String discussionId;

    private JSONArray richText;

    /**
     * 纯文本评论
     *
     * @param pageId 页面 ID
     * @param text   评论内容
     * @return 请求
     */
    public static CommentRequest onPage(String pageId, String text) {
        JSONObject content = new JSONObject(true);
        content.put("content", text);
        JSONObject item = new JSONObject(true);
        item.put("text", content);
        JSONArray richText = new JSONArray();
        richText.add(item);
        return CommentRequest.builder().parentPageId(pageId).richText(richText).build();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject(true);
        if (parentPageId != null) {
            JSONObject parent = new JSONObject(true);
            parent.put("page_id", parentPageId);
            json.put("parent", parent);
        }
        if (discussionId != null) {
            json.put("discussion_id", discussionId);
        }
        json.put("rich_text", richText == null ? new JSONArray() : richText);
        return json;
    }
}
