package cn.bafuka.notioncache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评论查询参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentQuery {

    /**
     * 页面或块 ID
     */
    private String blockId;

    private String startCursor;

    private Integer pageSize;
}
