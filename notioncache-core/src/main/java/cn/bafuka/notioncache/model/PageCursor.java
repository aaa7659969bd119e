package cn.bafuka.notioncache.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分页参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageCursor {

    private String startCursor;

    private Integer pageSize;
}
