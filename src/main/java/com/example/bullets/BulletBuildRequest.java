package com.example.bullets;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** 构建请求：按出现顺序分组的 (分区, 文本) 条目 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulletBuildRequest {
    private String documentId;          // 可空，空时自动生成
    private String locale;              // 可空
    private boolean strict;
    private List<Item> items = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String section;
        private String text;
        private int level;
    }
}
